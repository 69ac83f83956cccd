package uk.gegc.aegis.features.program.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.program.domain.model.DrugProgram;
import uk.gegc.aegis.features.program.domain.model.ProgramStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "DrugProgramDto")
public record DrugProgramDto(
        UUID id,
        String name,
        String brandName,
        String slug,
        ProgramStatus status,
        @Schema(description = "Questionnaire version patients are screened with; null until one is published")
        UUID activeQuestionnaireVersionId,
        Instant createdAt,
        Instant updatedAt
) {
    public static DrugProgramDto from(DrugProgram program) {
        return new DrugProgramDto(
                program.getId(),
                program.getName(),
                program.getBrandName(),
                program.getSlug(),
                program.getStatus(),
                program.getActiveQuestionnaireVersionId(),
                program.getCreatedAt(),
                program.getUpdatedAt()
        );
    }
}
