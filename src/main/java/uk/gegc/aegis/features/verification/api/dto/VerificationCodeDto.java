package uk.gegc.aegis.features.verification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.verification.domain.model.CodeStatus;
import uk.gegc.aegis.features.verification.domain.model.CodeType;
import uk.gegc.aegis.features.verification.domain.model.VerificationCode;

import java.time.Instant;

@Schema(name = "VerificationCodeDto")
public record VerificationCodeDto(
        @Schema(example = "AEGIS-7KQ2-M9XH-3PDA") String code,
        CodeType type,
        Instant expiresAt,
        @Schema(example = "unused") CodeStatus status
) {
    public static VerificationCodeDto from(VerificationCode code, Instant now) {
        return new VerificationCodeDto(code.getCode(), code.getType(), code.getExpiresAt(), code.effectiveStatus(now));
    }
}
