package uk.gegc.aegis.features.verification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

@Schema(name = "RedeemCodeRequest", description = "Partner checkout redemption")
public record RedeemCodeRequest(
        @Schema(requiredMode = Schema.RequiredMode.REQUIRED, example = "AEGIS-7KQ2-M9XH-3PDA")
        @NotBlank(message = "Code is required")
        @Size(max = 32, message = "Code must not exceed 32 characters")
        String code,

        @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "Partner's own transaction reference")
        @NotBlank(message = "Transaction id is required")
        @Size(max = 100, message = "Transaction id must not exceed 100 characters")
        String transactionId,

        @Schema(description = "Free-form context such as locationId, orderId or amount. Stored in the audit trail only.")
        Map<String, Object> metadata
) {
}
