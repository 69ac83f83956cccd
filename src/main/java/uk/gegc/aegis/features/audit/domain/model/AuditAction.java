package uk.gegc.aegis.features.audit.domain.model;

public enum AuditAction {
    PROGRAM_CREATED("program.created"),
    PROGRAM_STATUS_CHANGED("program.status_changed"),
    QUESTIONNAIRE_VERSION_CREATED("questionnaire.version_created"),
    QUESTIONNAIRE_VERSION_PUBLISHED("questionnaire.version_published"),
    SESSION_COMPLETED("session.completed"),
    CODE_ISSUED("code.issued"),
    CODE_VERIFIED("code.verified"),
    CODE_VERIFICATION_FAILED("code.verification_failed"),
    CODES_EXPIRED("code.expired_sweep"),
    PARTNER_CREATED("partner.created"),
    API_KEY_ISSUED("partner.api_key_issued"),
    API_KEY_REVOKED("partner.api_key_revoked");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
