package uk.gegc.aegis.features.questionnaire.infra.legacy;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LegacyOutcome {
    @JsonProperty("ok_to_use")
    OK_TO_USE,
    @JsonProperty("ask_a_doctor")
    ASK_A_DOCTOR,
    @JsonProperty("do_not_use")
    DO_NOT_USE
}
