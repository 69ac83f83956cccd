package uk.gegc.aegis.features.partner.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

@Schema(name = "IssueApiKeyRequest")
public record IssueApiKeyRequest(
        @Schema(description = "Days until the key stops working. Omit for a key that does not expire.", example = "365")
        @Min(value = 1, message = "expiresInDays must be at least 1")
        @Max(value = 3650, message = "expiresInDays must be at most 3650")
        Integer expiresInDays
) {
}
