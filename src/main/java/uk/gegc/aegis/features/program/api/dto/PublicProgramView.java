package uk.gegc.aegis.features.program.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.questionnaire.domain.model.Question;

import java.util.List;
import java.util.UUID;

/**
 * What a patient sees before starting a screening. Decision rules are never part of it.
 */
@Schema(name = "PublicProgramView", description = "Program and questions shown to a patient")
public record PublicProgramView(
        String slug,
        String name,
        String brandName,
        UUID questionnaireVersionId,
        String title,
        String description,
        List<Question> questions,
        List<String> disclaimers
) {
}
