package uk.gegc.aegis.features.questionnaire.infra.handler;

/**
 * A single answer rejected by its handler. Collected per question by the evaluation engine.
 */
public class InvalidAnswerException extends RuntimeException {
    public InvalidAnswerException(String message) {
        super(message);
    }
}
