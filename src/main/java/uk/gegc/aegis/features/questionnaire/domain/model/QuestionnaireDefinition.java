package uk.gegc.aegis.features.questionnaire.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Content of one questionnaire version: the ordered questions plus the ruleset that decides the outcome.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionnaireDefinition(
        String title,
        String description,
        List<Question> questions,
        Ruleset ruleset,
        List<String> disclaimers
) {
    public QuestionnaireDefinition {
        questions = questions == null ? List.of() : List.copyOf(questions);
        disclaimers = disclaimers == null ? List.of() : List.copyOf(disclaimers);
    }
}
