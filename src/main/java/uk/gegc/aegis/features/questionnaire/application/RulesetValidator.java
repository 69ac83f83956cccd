package uk.gegc.aegis.features.questionnaire.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.exception.RulesetConfigurationException;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.OutcomeBucket;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireDefinition;
import uk.gegc.aegis.features.questionnaire.domain.model.Ruleset;
import uk.gegc.aegis.features.questionnaire.infra.factory.AnswerHandlerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural checks for questionnaire content. Runs when a version is created and again when it
 * is published, so that no malformed ruleset can become active.
 */
@Component
@RequiredArgsConstructor
public class RulesetValidator {

    private final AnswerHandlerFactory handlerFactory;

    public void validate(QuestionnaireDefinition definition) {
        List<String> violations = new ArrayList<>();
        if (definition == null) {
            throw new RulesetConfigurationException("Questionnaire definition is missing");
        }

        Map<String, Question> questions = new LinkedHashMap<>();
        if (definition.questions().isEmpty()) {
            violations.add("Questionnaire must contain at least one question");
        }
        for (Question question : definition.questions()) {
            if (question.id() == null || question.id().isBlank()) {
                violations.add("Every question must have an id");
                continue;
            }
            if (questions.putIfAbsent(question.id(), question) != null) {
                violations.add("Question id '%s' is used more than once".formatted(question.id()));
                continue;
            }
            if (question.type() == null) {
                violations.add("Question '%s' has no type".formatted(question.id()));
                continue;
            }
            handlerFactory.getHandler(question.type()).validateDefinition(question, violations);
        }

        Ruleset ruleset = definition.ruleset();
        if (ruleset == null) {
            violations.add("Questionnaire must define a ruleset");
        } else {
            validateBuckets("ineligible", ruleset.ineligible(), questions, violations);
            validateBuckets("eligible", ruleset.eligible(), questions, violations);
        }

        if (!violations.isEmpty()) {
            throw new RulesetConfigurationException(violations);
        }
    }

    private void validateBuckets(String outcome,
                                 List<OutcomeBucket> buckets,
                                 Map<String, Question> questions,
                                 List<String> violations) {
        for (int i = 0; i < buckets.size(); i++) {
            OutcomeBucket bucket = buckets.get(i);
            if (bucket.conditions().isEmpty()) {
                violations.add("Bucket %d of outcome '%s' has no conditions".formatted(i, outcome));
                continue;
            }
            for (Condition condition : bucket.conditions()) {
                validateCondition(condition, questions, violations);
            }
        }
    }

    private void validateCondition(Condition condition, Map<String, Question> questions, List<String> violations) {
        Question question = questions.get(condition.questionId());
        if (question == null) {
            violations.add("Condition references unknown question '%s'".formatted(condition.questionId()));
            return;
        }
        Optional<ComparisonOperator> operator = ComparisonOperator.fromValue(condition.operator());
        if (operator.isEmpty()) {
            violations.add("Condition on question '%s' uses unknown operator '%s'"
                    .formatted(condition.questionId(), condition.operator()));
            return;
        }
        if (question.type() == null) {
            return;
        }
        handlerFactory.getHandler(question.type()).validateCondition(question, condition, operator.get(), violations);
    }
}
