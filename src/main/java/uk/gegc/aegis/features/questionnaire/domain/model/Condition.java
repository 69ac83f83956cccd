package uk.gegc.aegis.features.questionnaire.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One comparison inside an outcome bucket.
 *
 * <p>{@code operator} is kept as written so that unknown operators surface as configuration
 * errors instead of failing deserialization. {@code field} selects a sub-field of a
 * diagnostic-test answer and is null for every other question type.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Condition(
        String questionId,
        String field,
        String operator,
        JsonNode value
) {
    public static Condition of(String questionId, ComparisonOperator operator, JsonNode value) {
        return new Condition(questionId, null, operator.value(), value);
    }

    public static Condition of(String questionId, String field, ComparisonOperator operator, JsonNode value) {
        return new Condition(questionId, field, operator.value(), value);
    }
}
