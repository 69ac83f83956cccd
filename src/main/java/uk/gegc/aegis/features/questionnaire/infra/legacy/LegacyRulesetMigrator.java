package uk.gegc.aegis.features.questionnaire.infra.legacy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.exception.RulesetConfigurationException;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.OutcomeBucket;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;
import uk.gegc.aegis.features.questionnaire.domain.model.Ruleset;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One-time conversion of first-match legacy rules into a condition-bucket {@link Ruleset}.
 *
 * <p>Each condition is parsed and rewritten into disjunctive normal form, so every disjunct becomes
 * one bucket:</p>
 * <ul>
 *     <li>ineligible: every {@code do_not_use} rule, regardless of position, plus "no rule matched"
 *     when the default is {@code do_not_use};</li>
 *     <li>eligible: each {@code ok_to_use} rule together with the negation of every earlier rule
 *     that is not {@code ok_to_use}, plus "no restricting rule matched" when the default is
 *     {@code ok_to_use};</li>
 *     <li>{@code ask_a_doctor} needs no buckets; it is the engine's default.</li>
 * </ul>
 *
 * <p>Taking every {@code do_not_use} rule regardless of order can only move a legacy
 * {@code ok_to_use} or {@code ask_a_doctor} result towards ineligible. A negated comparison is also
 * false when the answer is absent, which can only remove eligibility.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LegacyRulesetMigrator {

    static final int MAX_BUCKETS_PER_OUTCOME = 256;

    private final ConditionExpressionParser parser;

    public Ruleset migrate(LegacyLogic logic, List<Question> questions) {
        if (logic == null || logic.defaultOutcome() == null) {
            throw new RulesetConfigurationException("Legacy logic must declare a default outcome");
        }
        Map<String, Question> questionIndex = new LinkedHashMap<>();
        questions.forEach(question -> questionIndex.putIfAbsent(question.id(), question));

        List<OutcomeBucket> ineligible = new ArrayList<>();
        List<OutcomeBucket> eligible = new ArrayList<>();
        List<LegacyExpression> restrictingSoFar = new ArrayList<>();

        for (LegacyRule rule : logic.rules()) {
            if (rule.outcome() == null) {
                throw new RulesetConfigurationException("Legacy rule '%s' has no outcome".formatted(rule.condition()));
            }
            LegacyExpression expression = parser.parse(rule.condition());
            switch (rule.outcome()) {
                case DO_NOT_USE -> {
                    addBuckets(ineligible, toDnf(expression, false, questionIndex), rule.message());
                    restrictingSoFar.add(expression);
                }
                case ASK_A_DOCTOR -> restrictingSoFar.add(expression);
                case OK_TO_USE -> {
                    List<List<Condition>> dnf = toDnf(expression, false, questionIndex);
                    for (LegacyExpression earlier : restrictingSoFar) {
                        dnf = product(dnf, toDnf(earlier, true, questionIndex));
                    }
                    addBuckets(eligible, dnf, rule.message());
                }
            }
        }

        switch (logic.defaultOutcome()) {
            case OK_TO_USE -> addBuckets(eligible, noneMatch(restrictingSoFar, questionIndex, logic), null);
            case DO_NOT_USE -> addBuckets(ineligible, noneMatch(allRules(logic), questionIndex, logic), null);
            case ASK_A_DOCTOR -> {
            }
        }

        requireWithinCap("ineligible", ineligible);
        requireWithinCap("eligible", eligible);
        log.info("Migrated {} legacy rules into {} ineligible and {} eligible buckets",
                logic.rules().size(), ineligible.size(), eligible.size());
        return new Ruleset(ineligible, eligible);
    }

    private List<LegacyExpression> allRules(LegacyLogic logic) {
        List<LegacyExpression> expressions = new ArrayList<>();
        for (LegacyRule rule : logic.rules()) {
            expressions.add(parser.parse(rule.condition()));
        }
        return expressions;
    }

    private List<List<Condition>> noneMatch(List<LegacyExpression> rules,
                                            Map<String, Question> questions,
                                            LegacyLogic logic) {
        if (rules.isEmpty()) {
            throw new RulesetConfigurationException(
                    "Default outcome '%s' cannot be expressed without at least one rule to negate"
                            .formatted(logic.defaultOutcome().name().toLowerCase(Locale.ROOT)));
        }
        List<List<Condition>> dnf = List.of(List.of());
        for (LegacyExpression rule : rules) {
            dnf = product(dnf, toDnf(rule, true, questions));
        }
        return dnf;
    }

    private List<List<Condition>> toDnf(LegacyExpression expression, boolean negated, Map<String, Question> questions) {
        if (expression instanceof LegacyExpression.Not not) {
            return toDnf(not.operand(), !negated, questions);
        }
        if (expression instanceof LegacyExpression.And and) {
            List<List<Condition>> left = toDnf(and.left(), negated, questions);
            List<List<Condition>> right = toDnf(and.right(), negated, questions);
            return negated ? union(left, right) : product(left, right);
        }
        if (expression instanceof LegacyExpression.Or or) {
            List<List<Condition>> left = toDnf(or.left(), negated, questions);
            List<List<Condition>> right = toDnf(or.right(), negated, questions);
            return negated ? product(left, right) : union(left, right);
        }
        if (expression instanceof LegacyExpression.Comparison comparison) {
            Condition condition = toCondition(comparison, negated, questions);
            return List.of(List.of(condition));
        }
        throw new RulesetConfigurationException("Unsupported legacy expression " + expression);
    }

    private Condition toCondition(LegacyExpression.Comparison comparison, boolean negated, Map<String, Question> questions) {
        String identifier = comparison.identifier();
        int dot = identifier.indexOf('.');
        String questionId = dot < 0 ? identifier : identifier.substring(0, dot);
        String field = dot < 0 ? null : identifier.substring(dot + 1);

        Question question = questions.get(questionId);
        if (question == null) {
            throw new RulesetConfigurationException("Legacy condition references unknown question '%s'".formatted(questionId));
        }
        ComparisonOperator operator = switch (comparison.operator()) {
            case "==" -> ComparisonOperator.EQUALS;
            case "!=" -> ComparisonOperator.NOT_EQUALS;
            case "<" -> ComparisonOperator.LESS_THAN;
            case "<=" -> ComparisonOperator.LESS_THAN_OR_EQUAL;
            case ">" -> ComparisonOperator.GREATER_THAN;
            case ">=" -> ComparisonOperator.GREATER_THAN_OR_EQUAL;
            default -> throw new RulesetConfigurationException("Unsupported legacy operator '%s'".formatted(comparison.operator()));
        };
        if (negated) {
            operator = operator.negate();
        }
        JsonNode value = coerceLiteral(question, field, comparison.literal());
        return Condition.of(questionId, field, operator, value);
    }

    /**
     * Legacy screeners compared boolean answers against 'yes'/'no' strings and numeric answers
     * against quoted numbers.
     */
    private JsonNode coerceLiteral(Question question, String field, JsonNode literal) {
        boolean booleanTarget = question.type() == QuestionType.BOOLEAN
                || (question.type() == QuestionType.DIAGNOSTIC_TEST && "hasTest".equals(field));
        if (booleanTarget && literal.isTextual()) {
            String text = literal.textValue().trim().toLowerCase(Locale.ROOT);
            if (text.equals("yes") || text.equals("true")) {
                return BooleanNode.TRUE;
            }
            if (text.equals("no") || text.equals("false")) {
                return BooleanNode.FALSE;
            }
        }
        if (question.type() == QuestionType.NUMERIC && literal.isTextual()) {
            try {
                return DecimalNode.valueOf(new BigDecimal(literal.textValue().trim()));
            } catch (NumberFormatException e) {
                throw new RulesetConfigurationException(
                        "Legacy condition compares numeric question '%s' with '%s'".formatted(question.id(), literal.textValue()));
            }
        }
        return literal;
    }

    private static List<List<Condition>> union(List<List<Condition>> left, List<List<Condition>> right) {
        List<List<Condition>> result = new ArrayList<>(left);
        result.addAll(right);
        requireWithinCap("intermediate", result);
        return result;
    }

    private static List<List<Condition>> product(List<List<Condition>> left, List<List<Condition>> right) {
        List<List<Condition>> result = new ArrayList<>();
        for (List<Condition> l : left) {
            for (List<Condition> r : right) {
                Set<Condition> conjunction = new LinkedHashSet<>(l);
                conjunction.addAll(r);
                result.add(List.copyOf(conjunction));
                requireWithinCap("intermediate", result);
            }
        }
        return result;
    }

    private static void addBuckets(List<OutcomeBucket> target, List<List<Condition>> dnf, String message) {
        Set<List<Condition>> seen = new LinkedHashSet<>();
        target.forEach(bucket -> seen.add(bucket.conditions()));
        for (List<Condition> conjunction : dnf) {
            if (!conjunction.isEmpty() && seen.add(conjunction)) {
                target.add(new OutcomeBucket(conjunction, message));
            }
        }
    }

    private static void requireWithinCap(String outcome, List<?> buckets) {
        if (buckets.size() > MAX_BUCKETS_PER_OUTCOME) {
            throw new RulesetConfigurationException(
                    "Legacy logic expands to more than %d %s buckets".formatted(MAX_BUCKETS_PER_OUTCOME, outcome));
        }
    }
}
