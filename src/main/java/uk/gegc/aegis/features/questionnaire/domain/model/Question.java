package uk.gegc.aegis.features.questionnaire.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Question(
        String id,
        QuestionType type,
        String text,
        String helpText,
        boolean required,
        List<String> options,
        BigDecimal min,
        BigDecimal max,
        EhrMapping ehrMapping,
        String testType
) {
    public Question {
        options = options == null ? null : List.copyOf(options);
    }
}
