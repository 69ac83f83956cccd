package uk.gegc.aegis.features.partner.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.partner.domain.model.Partner;
import uk.gegc.aegis.features.partner.domain.model.PartnerStatus;
import uk.gegc.aegis.features.partner.domain.model.PartnerType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "PartnerDto")
public record PartnerDto(UUID id, String name, PartnerType type, PartnerStatus status, Instant createdAt) {

    public static PartnerDto from(Partner partner) {
        return new PartnerDto(partner.getId(), partner.getName(), partner.getType(), partner.getStatus(), partner.getCreatedAt());
    }
}
