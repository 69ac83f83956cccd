package uk.gegc.aegis.features.questionnaire.application;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.exception.AnswerValidationException;
import uk.gegc.aegis.features.questionnaire.domain.exception.RulesetConfigurationException;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.features.questionnaire.domain.model.OutcomeBucket;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireDefinition;
import uk.gegc.aegis.features.questionnaire.domain.model.Ruleset;
import uk.gegc.aegis.features.questionnaire.infra.factory.AnswerHandlerFactory;
import uk.gegc.aegis.features.questionnaire.infra.handler.AnswerHandler;
import uk.gegc.aegis.features.questionnaire.infra.handler.InvalidAnswerException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides the outcome of a completed questionnaire.
 *
 * <p>Answers are validated first and every violation is reported together. The ruleset is then
 * applied in a fixed order: any matching ineligible bucket wins, otherwise any matching eligible
 * bucket, otherwise {@link Outcome#CONSULT_PROFESSIONAL}. A bucket with no conditions never matches
 * and a condition on an unanswered question is false.</p>
 *
 * <p>The engine holds no state and performs no I/O. Content that cannot be evaluated raises
 * {@link RulesetConfigurationException} instead of producing an outcome.</p>
 */
@Component
@RequiredArgsConstructor
public class EvaluationEngine {

    private final AnswerHandlerFactory handlerFactory;

    public EvaluationResult evaluate(QuestionnaireDefinition definition, Map<String, JsonNode> answers) {
        Map<String, Question> questions = indexQuestions(definition);
        Map<String, JsonNode> normalized = validateAnswers(questions, answers == null ? Map.of() : answers);

        Ruleset ruleset = definition.ruleset();
        if (ruleset == null) {
            throw new RulesetConfigurationException("Questionnaire has no ruleset");
        }

        OutcomeBucket ineligible = firstMatch(ruleset.ineligible(), questions, normalized);
        if (ineligible != null) {
            return new EvaluationResult(Outcome.INELIGIBLE, ineligible.message(), normalized);
        }
        OutcomeBucket eligible = firstMatch(ruleset.eligible(), questions, normalized);
        if (eligible != null) {
            return new EvaluationResult(Outcome.ELIGIBLE, eligible.message(), normalized);
        }
        return new EvaluationResult(Outcome.CONSULT_PROFESSIONAL, null, normalized);
    }

    private Map<String, Question> indexQuestions(QuestionnaireDefinition definition) {
        Map<String, Question> questions = new LinkedHashMap<>();
        for (Question question : definition.questions()) {
            if (questions.putIfAbsent(question.id(), question) != null) {
                throw new RulesetConfigurationException("Question id '%s' is used more than once".formatted(question.id()));
            }
        }
        return questions;
    }

    private Map<String, JsonNode> validateAnswers(Map<String, Question> questions, Map<String, JsonNode> answers) {
        Map<String, String> violations = new LinkedHashMap<>();
        Map<String, JsonNode> normalized = new LinkedHashMap<>();

        for (Question question : questions.values()) {
            JsonNode raw = answers.get(question.id());
            if (raw == null || raw.isNull()) {
                if (question.required()) {
                    violations.put(question.id(), "answer is required");
                }
                continue;
            }
            try {
                normalized.put(question.id(), handlerFor(question).normalize(question, raw));
            } catch (InvalidAnswerException e) {
                violations.put(question.id(), e.getMessage());
            }
        }
        for (String answeredId : answers.keySet()) {
            if (!questions.containsKey(answeredId)) {
                violations.put(answeredId, "is not a question in this questionnaire");
            }
        }

        if (!violations.isEmpty()) {
            throw new AnswerValidationException(violations);
        }
        return Collections.unmodifiableMap(normalized);
    }

    private OutcomeBucket firstMatch(List<OutcomeBucket> buckets,
                                     Map<String, Question> questions,
                                     Map<String, JsonNode> answers) {
        for (OutcomeBucket bucket : buckets) {
            if (matches(bucket, questions, answers)) {
                return bucket;
            }
        }
        return null;
    }

    private boolean matches(OutcomeBucket bucket, Map<String, Question> questions, Map<String, JsonNode> answers) {
        if (bucket.conditions().isEmpty()) {
            return false;
        }
        // every condition is evaluated so that a broken reference anywhere in the bucket is reported
        boolean all = true;
        for (Condition condition : bucket.conditions()) {
            all &= holds(condition, questions, answers);
        }
        return all;
    }

    private boolean holds(Condition condition, Map<String, Question> questions, Map<String, JsonNode> answers) {
        Question question = questions.get(condition.questionId());
        if (question == null) {
            throw new RulesetConfigurationException("Condition references unknown question '%s'".formatted(condition.questionId()));
        }
        ComparisonOperator operator = ComparisonOperator.fromValue(condition.operator())
                .orElseThrow(() -> new RulesetConfigurationException(
                        "Condition on question '%s' uses unknown operator '%s'".formatted(question.id(), condition.operator())));
        JsonNode expected = condition.value();
        if (expected == null || expected.isNull()) {
            throw new RulesetConfigurationException("Condition on question '%s' has no value".formatted(question.id()));
        }

        JsonNode actual = handlerFor(question).operand(answers.get(question.id()), condition.field());
        if (actual == null || actual.isNull()) {
            return false;
        }
        return compare(question, operator, actual, expected);
    }

    private boolean compare(Question question, ComparisonOperator operator, JsonNode actual, JsonNode expected) {
        if (expected.isBoolean()) {
            if (!actual.isBoolean() || operator.isOrdering()) {
                throw mismatch(question, operator, expected);
            }
            return operator.test(actual.booleanValue() == expected.booleanValue() ? 0 : 1);
        }
        if (expected.isNumber()) {
            BigDecimal left = numericValue(actual);
            if (left == null) {
                if (actual.isTextual()) {
                    return unequal(operator);
                }
                throw mismatch(question, operator, expected);
            }
            return operator.test(left.compareTo(expected.decimalValue()));
        }
        if (expected.isTextual()) {
            if (operator.isOrdering() || actual.isBoolean()) {
                throw mismatch(question, operator, expected);
            }
            if (!actual.isTextual()) {
                return unequal(operator);
            }
            return operator.test(actual.textValue().equals(expected.textValue()) ? 0 : 1);
        }
        throw mismatch(question, operator, expected);
    }

    /**
     * A text answer against a number, or the reverse: the values differ and have no order.
     */
    private static boolean unequal(ComparisonOperator operator) {
        return operator == ComparisonOperator.NOT_EQUALS;
    }

    private static BigDecimal numericValue(JsonNode node) {
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return null;
            }
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static RulesetConfigurationException mismatch(Question question, ComparisonOperator operator, JsonNode expected) {
        return new RulesetConfigurationException("Condition '%s %s %s' cannot be evaluated against a %s answer"
                .formatted(question.id(), operator.value(), expected, question.type()));
    }

    private AnswerHandler handlerFor(Question question) {
        if (question.type() == null) {
            throw new RulesetConfigurationException("Question '%s' has no type".formatted(question.id()));
        }
        return handlerFactory.getHandler(question.type());
    }
}
