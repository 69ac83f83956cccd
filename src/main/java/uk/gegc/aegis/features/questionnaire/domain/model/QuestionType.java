package uk.gegc.aegis.features.questionnaire.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum QuestionType {
    BOOLEAN("boolean", "yes_no"),
    SINGLE_CHOICE("single_choice", "choice", "multiple_choice"),
    NUMERIC("numeric"),
    DIAGNOSTIC_TEST("diagnostic_test");

    private final String value;
    private final String[] legacyNames;

    QuestionType(String value, String... legacyNames) {
        this.value = value;
        this.legacyNames = legacyNames;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Accepts the canonical name and the names used by older screener exports.
     */
    @JsonCreator
    public static QuestionType fromValue(String value) {
        for (QuestionType type : values()) {
            if (type.value.equals(value) || Arrays.asList(type.legacyNames).contains(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported question type: " + value);
    }
}
