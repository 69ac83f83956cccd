package uk.gegc.aegis.features.partner.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.aegis.features.partner.domain.model.PartnerType;

@Schema(name = "CreatePartnerRequest")
public record CreatePartnerRequest(
        @Schema(example = "Northside Pharmacy", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Name is required")
        @Size(max = 200, message = "Name must not exceed 200 characters")
        String name,

        @Schema(example = "PHARMACY", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Type is required")
        PartnerType type
) {
}
