package uk.gegc.aegis.features.questionnaire.infra.legacy;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Syntax tree of a legacy condition string. Only these node kinds exist.
 */
public interface LegacyExpression {

    /**
     * {@code identifier operator literal}. {@code identifier} may be dotted, e.g. {@code cholesterol_test.hasTest}.
     */
    record Comparison(String identifier, String operator, JsonNode literal) implements LegacyExpression {
    }

    record And(LegacyExpression left, LegacyExpression right) implements LegacyExpression {
    }

    record Or(LegacyExpression left, LegacyExpression right) implements LegacyExpression {
    }

    record Not(LegacyExpression operand) implements LegacyExpression {
    }
}
