package uk.gegc.aegis.features.verification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.features.verification.application.RedemptionResult;
import uk.gegc.aegis.features.verification.domain.model.CodeType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "RedeemCodeResponse")
public record RedeemCodeResponse(
        boolean valid,
        @Schema(description = "Set when valid is false", allowableValues = {"not_found", "already_used", "expired"})
        String error,
        RedeemedCode code,
        RedeemedSession session
) {
    public record RedeemedCode(String code, CodeType type, Instant usedAt) {
    }

    public record RedeemedSession(UUID id, Outcome outcome, Instant completedAt) {
    }

    public static RedeemCodeResponse from(RedemptionResult result) {
        if (!result.valid()) {
            return new RedeemCodeResponse(false, result.failure().value(), null, null);
        }
        return new RedeemCodeResponse(
                true,
                null,
                new RedeemedCode(result.code().getCode(), result.code().getType(), result.code().getUsedAt()),
                new RedeemedSession(result.session().id(), result.session().outcome(), result.session().completedAt())
        );
    }
}
