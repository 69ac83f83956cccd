package uk.gegc.aegis.features.questionnaire.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;

import java.math.BigDecimal;
import java.util.List;

@Component
public class NumericAnswerHandler extends AnswerHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.NUMERIC;
    }

    @Override
    public void validateDefinition(Question question, List<String> violations) {
        if (question.min() != null && question.max() != null && question.min().compareTo(question.max()) > 0) {
            violations.add("Numeric question '%s' has min greater than max".formatted(question.id()));
        }
    }

    @Override
    public void validateCondition(Question question, Condition condition, ComparisonOperator operator, List<String> violations) {
        requireNoField(question, condition, violations);
        if (condition.value() == null || !condition.value().isNumber()) {
            violations.add("Condition on numeric question '%s' must compare against a number".formatted(question.id()));
        }
    }

    @Override
    public JsonNode normalize(Question question, JsonNode answer) {
        BigDecimal value = parse(answer);
        if (value == null) {
            throw new InvalidAnswerException("must be a number");
        }
        if (question.min() != null && value.compareTo(question.min()) < 0) {
            throw new InvalidAnswerException("must be at least " + question.min().toPlainString());
        }
        if (question.max() != null && value.compareTo(question.max()) > 0) {
            throw new InvalidAnswerException("must be at most " + question.max().toPlainString());
        }
        return DecimalNode.valueOf(value);
    }

    /**
     * Accepts JSON numbers and numeric strings. Returns null for anything else, including floating
     * point literals that overflow a double.
     */
    static BigDecimal parse(JsonNode node) {
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return null;
            }
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
