package uk.gegc.aegis.shared.tenant;

public class InvalidTenantIdException extends RuntimeException {
    public InvalidTenantIdException(String message) {
        super(message);
    }
}
