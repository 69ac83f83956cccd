package uk.gegc.aegis.features.program.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.aegis.features.program.domain.model.ProgramStatus;

@Schema(name = "UpdateProgramStatusRequest")
public record UpdateProgramStatusRequest(
        @Schema(description = "New program status", example = "ACTIVE", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Status is required")
        ProgramStatus status
) {
}
