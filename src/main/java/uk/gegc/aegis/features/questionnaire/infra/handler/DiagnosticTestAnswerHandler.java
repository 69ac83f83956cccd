package uk.gegc.aegis.features.questionnaire.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;

import java.util.List;
import java.util.Set;

/**
 * Answers of the form {@code {"hasTest": true, "testName": "...", "testDate": "...", "result": "...", "uploadUrl": "..."}}.
 * Conditions address one sub-field through {@link Condition#field()}.
 */
@Component
public class DiagnosticTestAnswerHandler extends AnswerHandler {

    public static final String HAS_TEST = "hasTest";
    public static final String RESULT = "result";
    public static final String TEST_NAME = "testName";
    public static final String TEST_DATE = "testDate";
    private static final String UPLOAD_URL = "uploadUrl";

    private static final Set<String> TEXT_FIELDS = Set.of(TEST_NAME, TEST_DATE, UPLOAD_URL);

    @Override
    public QuestionType supportedType() {
        return QuestionType.DIAGNOSTIC_TEST;
    }

    @Override
    public void validateDefinition(Question question, List<String> violations) {
        if (question.options() != null && !question.options().isEmpty()) {
            violations.add("Diagnostic-test question '%s' must not declare options".formatted(question.id()));
        }
    }

    @Override
    public void validateCondition(Question question, Condition condition, ComparisonOperator operator, List<String> violations) {
        String field = condition.field();
        JsonNode value = condition.value();
        if (field == null) {
            violations.add("Condition on diagnostic-test question '%s' must name a field".formatted(question.id()));
            return;
        }
        switch (field) {
            case HAS_TEST -> {
                requireEqualityOperator(question, operator, violations);
                if (value == null || !value.isBoolean()) {
                    violations.add("Condition on '%s.hasTest' must compare against true or false".formatted(question.id()));
                }
            }
            case RESULT -> {
                if (value == null || !(value.isTextual() || value.isNumber())) {
                    violations.add("Condition on '%s.result' must compare against text or a number".formatted(question.id()));
                } else if (value.isTextual()) {
                    requireEqualityOperator(question, operator, violations);
                }
            }
            case TEST_NAME, TEST_DATE -> {
                requireEqualityOperator(question, operator, violations);
                if (value == null || !value.isTextual()) {
                    violations.add("Condition on '%s.%s' must compare against text".formatted(question.id(), field));
                }
            }
            default -> violations.add("Condition on question '%s' uses unknown field '%s'".formatted(question.id(), field));
        }
    }

    @Override
    public JsonNode normalize(Question question, JsonNode answer) {
        if (!answer.isObject()) {
            throw new InvalidAnswerException("must be an object with a hasTest flag");
        }
        JsonNode hasTest = answer.get(HAS_TEST);
        if (hasTest == null || !hasTest.isBoolean()) {
            throw new InvalidAnswerException("hasTest must be true or false");
        }
        ObjectNode normalized = JsonNodeFactory.instance.objectNode();
        normalized.put(HAS_TEST, hasTest.booleanValue());
        for (String field : TEXT_FIELDS) {
            JsonNode value = answer.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (!value.isTextual()) {
                throw new InvalidAnswerException(field + " must be text");
            }
            normalized.put(field, value.textValue().trim());
        }
        JsonNode result = answer.get(RESULT);
        if (result != null && !result.isNull()) {
            if (result.isNumber()) {
                if (result.isFloatingPointNumber() && !Double.isFinite(result.doubleValue())) {
                    throw new InvalidAnswerException("result is out of range");
                }
                normalized.put(RESULT, result.decimalValue());
            } else if (result.isTextual()) {
                normalized.put(RESULT, result.textValue().trim());
            } else {
                throw new InvalidAnswerException("result must be text or a number");
            }
        }
        return normalized;
    }

    @Override
    public JsonNode operand(JsonNode normalizedAnswer, String field) {
        if (normalizedAnswer == null || field == null) {
            return null;
        }
        return normalizedAnswer.get(field);
    }
}
