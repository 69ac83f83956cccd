package uk.gegc.aegis.features.verification.application;

import uk.gegc.aegis.features.screening.api.dto.SessionStatusDto;
import uk.gegc.aegis.features.verification.domain.model.RedemptionFailure;
import uk.gegc.aegis.features.verification.domain.model.VerificationCode;

/**
 * Either the consumed code with its session, or the reason nothing was consumed.
 */
public record RedemptionResult(boolean valid, RedemptionFailure failure, VerificationCode code, SessionStatusDto session) {

    public static RedemptionResult success(VerificationCode code, SessionStatusDto session) {
        return new RedemptionResult(true, null, code, session);
    }

    public static RedemptionResult failed(RedemptionFailure failure) {
        return new RedemptionResult(false, failure, null, null);
    }
}
