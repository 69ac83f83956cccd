package uk.gegc.aegis.features.verification.domain.exception;

public class InvalidCodeFormatException extends RuntimeException {
    public InvalidCodeFormatException(String message) {
        super(message);
    }
}
