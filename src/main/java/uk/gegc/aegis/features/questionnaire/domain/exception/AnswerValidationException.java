package uk.gegc.aegis.features.questionnaire.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class AnswerValidationException extends RuntimeException {

    private final Map<String, String> violations;

    /**
     * @param violations reason per offending question id, in questionnaire order
     */
    public AnswerValidationException(Map<String, String> violations) {
        super("Answers failed validation for questions " + violations.keySet());
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    public Map<String, String> getViolations() {
        return violations;
    }
}
