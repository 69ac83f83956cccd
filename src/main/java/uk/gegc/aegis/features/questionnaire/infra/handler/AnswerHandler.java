package uk.gegc.aegis.features.questionnaire.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;

import java.util.List;

/**
 * Type-specific rules for one {@link QuestionType}: what a well-formed question looks like,
 * which conditions can reference it, and how submitted answers are validated and normalised.
 */
public abstract class AnswerHandler {

    /**
     * Returns the question type that this handler supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    /**
     * Adds a message to {@code violations} for every problem in the question itself.
     */
    public abstract void validateDefinition(Question question, List<String> violations);

    /**
     * Adds a message to {@code violations} when {@code condition} can never be evaluated against this question.
     */
    public abstract void validateCondition(Question question,
                                           Condition condition,
                                           ComparisonOperator operator,
                                           List<String> violations);

    /**
     * Validates a non-null submitted answer and returns its canonical form.
     *
     * @throws InvalidAnswerException with a caller-facing reason when the answer is unacceptable
     */
    public abstract JsonNode normalize(Question question, JsonNode answer);

    /**
     * Value a condition compares against, taken from a normalised answer. Null when absent.
     */
    public JsonNode operand(JsonNode normalizedAnswer, String field) {
        return normalizedAnswer;
    }

    protected static void requireNoField(Question question, Condition condition, List<String> violations) {
        if (condition.field() != null) {
            violations.add("Condition on question '%s' uses field '%s' but %s answers have no fields"
                    .formatted(question.id(), condition.field(), question.type()));
        }
    }

    protected static void requireEqualityOperator(Question question, ComparisonOperator operator, List<String> violations) {
        if (operator.isOrdering()) {
            violations.add("Operator '%s' cannot be applied to question '%s'"
                    .formatted(operator.value(), question.id()));
        }
    }
}
