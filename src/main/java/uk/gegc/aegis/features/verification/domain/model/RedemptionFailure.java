package uk.gegc.aegis.features.verification.domain.model;

/**
 * Reason a redemption did not consume the code. Partner integrations branch on {@link #value()}.
 */
public enum RedemptionFailure {
    NOT_FOUND("not_found"),
    ALREADY_USED("already_used"),
    EXPIRED("expired");

    private final String value;

    RedemptionFailure(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
