package uk.gegc.aegis.features.questionnaire.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;

import java.util.HashSet;
import java.util.List;

@Component
public class SingleChoiceAnswerHandler extends AnswerHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.SINGLE_CHOICE;
    }

    @Override
    public void validateDefinition(Question question, List<String> violations) {
        List<String> options = question.options();
        if (options == null || options.isEmpty()) {
            violations.add("Single-choice question '%s' must declare at least one option".formatted(question.id()));
            return;
        }
        if (new HashSet<>(options).size() != options.size()) {
            violations.add("Single-choice question '%s' declares duplicate options".formatted(question.id()));
        }
        if (options.stream().anyMatch(option -> option == null || option.isBlank())) {
            violations.add("Single-choice question '%s' declares a blank option".formatted(question.id()));
        }
    }

    @Override
    public void validateCondition(Question question, Condition condition, ComparisonOperator operator, List<String> violations) {
        requireNoField(question, condition, violations);
        requireEqualityOperator(question, operator, violations);
        JsonNode value = condition.value();
        if (value == null || !value.isTextual()) {
            violations.add("Condition on single-choice question '%s' must compare against an option value".formatted(question.id()));
            return;
        }
        if (question.options() != null && !question.options().contains(value.textValue())) {
            violations.add("Condition on question '%s' references '%s', which is not one of its options"
                    .formatted(question.id(), value.textValue()));
        }
    }

    @Override
    public JsonNode normalize(Question question, JsonNode answer) {
        if (!answer.isTextual()) {
            throw new InvalidAnswerException("must be one of the declared options");
        }
        String value = answer.textValue();
        if (question.options() == null || !question.options().contains(value)) {
            throw new InvalidAnswerException("must be one of the declared options");
        }
        return TextNode.valueOf(value);
    }
}
