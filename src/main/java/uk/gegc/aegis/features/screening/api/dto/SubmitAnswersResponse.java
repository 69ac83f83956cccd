package uk.gegc.aegis.features.screening.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SubmitAnswersResponse")
public record SubmitAnswersResponse(
        UUID sessionId,
        @Schema(example = "eligible") Outcome outcome,
        Instant completedAt,
        @Schema(description = "Message attached to the rule that decided the outcome, if any") String message
) {
}
