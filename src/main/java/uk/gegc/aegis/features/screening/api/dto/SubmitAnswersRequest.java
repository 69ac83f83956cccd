package uk.gegc.aegis.features.screening.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(name = "SubmitAnswersRequest", description = "Complete answer set for a screening session")
public record SubmitAnswersRequest(
        @Schema(
                description = "Answer per question id",
                requiredMode = Schema.RequiredMode.REQUIRED,
                example = "{\"age_check\": true, \"pregnancy_check\": false}"
        )
        @NotNull(message = "Answers are required")
        Map<String, JsonNode> answers
) {
}
