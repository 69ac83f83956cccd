package uk.gegc.aegis.features.questionnaire.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    EQUALS("equals", false),
    NOT_EQUALS("not_equals", false),
    GREATER_THAN("greater_than", true),
    LESS_THAN("less_than", true),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal", true),
    LESS_THAN_OR_EQUAL("less_than_or_equal", true);

    private final String value;
    private final boolean ordering;

    ComparisonOperator(String value, boolean ordering) {
        this.value = value;
        this.ordering = ordering;
    }

    public String value() {
        return value;
    }

    /**
     * True for operators that need an ordered operand (numbers), false for equality checks.
     */
    public boolean isOrdering() {
        return ordering;
    }

    public ComparisonOperator negate() {
        return switch (this) {
            case EQUALS -> NOT_EQUALS;
            case NOT_EQUALS -> EQUALS;
            case GREATER_THAN -> LESS_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN;
            case LESS_THAN -> GREATER_THAN_OR_EQUAL;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN;
        };
    }

    /**
     * Evaluates this operator against the result of {@code actual.compareTo(expected)}.
     */
    public boolean test(int comparison) {
        return switch (this) {
            case EQUALS -> comparison == 0;
            case NOT_EQUALS -> comparison != 0;
            case GREATER_THAN -> comparison > 0;
            case LESS_THAN -> comparison < 0;
            case GREATER_THAN_OR_EQUAL -> comparison >= 0;
            case LESS_THAN_OR_EQUAL -> comparison <= 0;
        };
    }

    public static Optional<ComparisonOperator> fromValue(String value) {
        return Arrays.stream(values())
                .filter(operator -> operator.value.equals(value))
                .findFirst();
    }
}
