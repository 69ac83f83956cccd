package uk.gegc.aegis.features.program.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "CreateProgramRequest", description = "Payload for registering a drug program")
public record CreateProgramRequest(
        @Schema(description = "Program name", example = "Atorvastatin OTC Switch", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Name is required")
        @Size(max = 200, message = "Name must not exceed 200 characters")
        String name,

        @Schema(description = "Brand shown to patients", example = "Lipitor", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Brand name is required")
        @Size(max = 200, message = "Brand name must not exceed 200 characters")
        String brandName,

        @Schema(description = "Public URL slug, lowercase words joined by hyphens", example = "lipitor-otc", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Slug is required")
        @Size(max = 120, message = "Slug must not exceed 120 characters")
        @Pattern(regexp = "^[a-z0-9]+(-[a-z0-9]+)*$", message = "Slug must be lowercase letters and digits separated by single hyphens")
        String slug
) {
}
