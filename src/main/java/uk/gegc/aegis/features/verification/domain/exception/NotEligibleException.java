package uk.gegc.aegis.features.verification.domain.exception;

import java.util.UUID;

public class NotEligibleException extends RuntimeException {
    public NotEligibleException(UUID sessionId) {
        super("Screening session " + sessionId + " is not eligible for a verification code");
    }
}
