package uk.gegc.aegis.features.screening.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "StartSessionResponse")
public record StartSessionResponse(
        @Schema(description = "New session id") UUID sessionId,
        @Schema(description = "Bearer token for the session endpoints") String sessionToken,
        @Schema(description = "Token expiry") Instant sessionTokenExpiresAt,
        @Schema(description = "Questionnaire version the session is pinned to") UUID questionnaireVersionId
) {
}
