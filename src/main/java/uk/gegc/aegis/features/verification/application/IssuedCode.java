package uk.gegc.aegis.features.verification.application;

import uk.gegc.aegis.features.verification.api.dto.VerificationCodeDto;

/**
 * @param created false when the session already had a code and that code was returned
 */
public record IssuedCode(VerificationCodeDto code, boolean created) {
}
