package uk.gegc.aegis.features.screening.domain.exception;

import java.util.UUID;

public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(UUID sessionId) {
        super("Screening session " + sessionId + " not found");
    }
}
