package uk.gegc.aegis.features.screening.domain.exception;

/**
 * A session token used against a session other than the one it was issued for.
 */
public class SessionAccessDeniedException extends RuntimeException {
    public SessionAccessDeniedException(String message) {
        super(message);
    }
}
