package uk.gegc.aegis.features.questionnaire.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;

import java.util.Map;

/**
 * @param message           message of the bucket that decided the outcome, null for the default outcome
 * @param normalizedAnswers validated answers in questionnaire order
 */
public record EvaluationResult(
        Outcome outcome,
        String message,
        Map<String, JsonNode> normalizedAnswers
) {
}
