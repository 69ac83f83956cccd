package uk.gegc.aegis.features.questionnaire.domain.exception;

import java.util.List;

/**
 * Questionnaire content that cannot be evaluated safely: dangling references, unknown operators,
 * values that can never match their question. Raised when a version is created or published, and
 * again if such content is reached during evaluation.
 */
public class RulesetConfigurationException extends RuntimeException {

    private final List<String> violations;

    public RulesetConfigurationException(List<String> violations) {
        super("Questionnaire configuration is invalid: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public RulesetConfigurationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
