package uk.gegc.aegis.features.verification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.verification.domain.model.CodeCheckStatus;

import java.time.Instant;

@Schema(name = "CodeCheckResponse")
public record CodeCheckResponse(
        String code,
        @Schema(example = "valid") CodeCheckStatus status,
        Instant expiresAt,
        Instant usedAt
) {
}
