package uk.gegc.aegis.features.questionnaire.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A conjunction of conditions. A bucket with no conditions never matches.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutcomeBucket(
        List<Condition> conditions,
        String message
) {
    public OutcomeBucket {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
