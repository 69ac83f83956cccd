package uk.gegc.aegis.features.questionnaire.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireDefinition;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireVersion;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "QuestionnaireVersionDto")
public record QuestionnaireVersionDto(
        UUID id,
        UUID programId,
        int versionNumber,
        QuestionnaireDefinition definition,
        String notes,
        String createdBy,
        Instant createdAt,
        @Schema(description = "Whether this version is the program's active questionnaire")
        boolean active
) {
    public static QuestionnaireVersionDto from(QuestionnaireVersion version, boolean active) {
        return new QuestionnaireVersionDto(
                version.getId(),
                version.getProgramId(),
                version.getVersionNumber(),
                version.getDefinition(),
                version.getNotes(),
                version.getCreatedBy(),
                version.getCreatedAt(),
                active
        );
    }
}
