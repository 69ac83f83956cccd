package uk.gegc.aegis.features.verification.infra;

import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.verification.config.VerificationProperties;
import uk.gegc.aegis.features.verification.domain.exception.InvalidCodeFormatException;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Produces codes such as {@code AEGIS-7KQ2-M9XH-3PDA}. The alphabet leaves out {@code I} and
 * {@code O} so printed codes cannot be misread as {@code 1} or {@code 0}.
 */
@Component
public class VerificationCodeGenerator {

    static final String ALPHABET = "0123456789ABCDEFGHJKLMNPQRSTUVWXYZ";

    private final SecureRandom random = new SecureRandom();
    private final VerificationProperties properties;
    private final Pattern format;
    private final String template;

    public VerificationCodeGenerator(VerificationProperties properties) {
        this.properties = properties;
        String group = "[" + ALPHABET + "]{" + properties.getGroupSize() + "}";
        this.format = Pattern.compile("^" + Pattern.quote(properties.getCodePrefix())
                + "(-" + group + "){" + properties.getGroupCount() + "}$");
        this.template = properties.getCodePrefix()
                + ("-" + "X".repeat(properties.getGroupSize())).repeat(properties.getGroupCount());
    }

    public String generate() {
        StringBuilder code = new StringBuilder(properties.getCodePrefix());
        for (int g = 0; g < properties.getGroupCount(); g++) {
            code.append('-');
            for (int i = 0; i < properties.getGroupSize(); i++) {
                code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
        }
        return code.toString();
    }

    public boolean isWellFormed(String code) {
        return code != null && format.matcher(code).matches();
    }

    /**
     * Rejects anything that could not have been issued. Lower case is not folded.
     */
    public void requireWellFormed(String code) {
        if (!isWellFormed(code)) {
            throw new InvalidCodeFormatException("Verification code must look like " + template);
        }
    }
}
