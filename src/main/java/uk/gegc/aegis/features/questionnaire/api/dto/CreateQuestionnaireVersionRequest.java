package uk.gegc.aegis.features.questionnaire.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;
import uk.gegc.aegis.features.questionnaire.domain.model.Ruleset;
import uk.gegc.aegis.features.questionnaire.infra.legacy.LegacyLogic;

import java.util.List;

@Schema(
        name = "CreateQuestionnaireVersionRequest",
        description = "New questionnaire edition. Supply either a condition-bucket ruleset or legacy ordered rules, never both."
)
public record CreateQuestionnaireVersionRequest(
        @Schema(description = "Title shown to patients", example = "Lipitor self-selection screener", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Title is required")
        @Size(max = 200, message = "Title must not exceed 200 characters")
        String title,

        @Schema(description = "Introductory text shown to patients")
        @Size(max = 2000, message = "Description must not exceed 2000 characters")
        String description,

        @Schema(description = "Ordered questions", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "At least one question is required")
        List<Question> questions,

        @Schema(description = "Condition-bucket ruleset")
        Ruleset ruleset,

        @Schema(description = "Ordered legacy rules with a default outcome, converted to a ruleset on import")
        LegacyLogic legacyLogic,

        @Schema(description = "Disclaimers shown with the questionnaire")
        List<String> disclaimers,

        @Schema(description = "Editor notes for this version")
        @Size(max = 2000, message = "Notes must not exceed 2000 characters")
        String notes
) {
}
