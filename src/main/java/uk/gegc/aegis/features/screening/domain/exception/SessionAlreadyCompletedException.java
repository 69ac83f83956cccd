package uk.gegc.aegis.features.screening.domain.exception;

import java.util.UUID;

public class SessionAlreadyCompletedException extends RuntimeException {
    public SessionAlreadyCompletedException(UUID sessionId) {
        super("Screening session " + sessionId + " is already completed");
    }
}
