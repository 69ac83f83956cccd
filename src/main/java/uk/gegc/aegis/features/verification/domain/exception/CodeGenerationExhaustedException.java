package uk.gegc.aegis.features.verification.domain.exception;

public class CodeGenerationExhaustedException extends RuntimeException {
    public CodeGenerationExhaustedException(int attempts) {
        super("Could not generate a unique verification code after " + attempts + " attempts");
    }
}
