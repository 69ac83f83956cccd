package uk.gegc.aegis.features.partner.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "IssuedApiKeyDto", description = "The raw key is shown once and cannot be retrieved again")
public record IssuedApiKeyDto(
        UUID id,
        UUID partnerId,
        @Schema(example = "ak_3f9k2m7q8z1c_Jx0...") String apiKey,
        String keyPrefix,
        Instant expiresAt
) {
}
