package uk.gegc.aegis.features.questionnaire.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;

import java.util.List;

@Component
public class BooleanAnswerHandler extends AnswerHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.BOOLEAN;
    }

    @Override
    public void validateDefinition(Question question, List<String> violations) {
        if (question.options() != null && !question.options().isEmpty()) {
            violations.add("Boolean question '%s' must not declare options".formatted(question.id()));
        }
    }

    @Override
    public void validateCondition(Question question, Condition condition, ComparisonOperator operator, List<String> violations) {
        requireNoField(question, condition, violations);
        requireEqualityOperator(question, operator, violations);
        if (condition.value() == null || !condition.value().isBoolean()) {
            violations.add("Condition on boolean question '%s' must compare against true or false".formatted(question.id()));
        }
    }

    @Override
    public JsonNode normalize(Question question, JsonNode answer) {
        if (!answer.isBoolean()) {
            throw new InvalidAnswerException("must be true or false");
        }
        return BooleanNode.valueOf(answer.booleanValue());
    }
}
