package uk.gegc.aegis.features.verification.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.aegis.features.verification.config.VerificationProperties;
import uk.gegc.aegis.features.verification.domain.exception.InvalidCodeFormatException;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationCodeGeneratorTest {

    private final VerificationCodeGenerator generator = new VerificationCodeGenerator(new VerificationProperties());

    @RepeatedTest(20)
    @DisplayName("generate: when called then the code matches PREFIX-XXXX-XXXX-XXXX over the unambiguous alphabet")
    void generatedCodesAreWellFormed() {
        String code = generator.generate();

        assertThat(code).matches("AEGIS-[0-9A-HJ-NP-Z]{4}-[0-9A-HJ-NP-Z]{4}-[0-9A-HJ-NP-Z]{4}");
        assertThat(generator.isWellFormed(code)).isTrue();
    }

    @Test
    @DisplayName("generate: when called many times then codes do not repeat")
    void codesAreRandom() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            codes.add(generator.generate());
        }

        assertThat(codes).hasSize(1_000);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "aegis-7KQ2-M9XH-3PDA",
            "AEGIS-7KQ2-M9XH",
            "AEGIS-7KQ2-M9XH-3PDA-ABCD",
            "AEGIS-7KQ2-M9XH-3PDI",
            "AEGIS-7KQ2-M9XH-3PD",
            "OTHER-7KQ2-M9XH-3PDA",
            "AEGIS-7KQ2-M9XH-3PDA "
    })
    @DisplayName("requireWellFormed: when the code could not have been issued then it throws")
    void rejectsMalformed(String code) {
        assertThatThrownBy(() -> generator.requireWellFormed(code))
                .isInstanceOf(InvalidCodeFormatException.class)
                .hasMessageContaining("AEGIS-XXXX-XXXX-XXXX");
    }

    @Test
    @DisplayName("requireWellFormed: when the code is well formed then it passes")
    void acceptsWellFormed() {
        assertThatCode(() -> generator.requireWellFormed("AEGIS-7KQ2-M9XH-3PDA")).doesNotThrowAnyException();
        assertThat(generator.isWellFormed(null)).isFalse();
    }

    @Test
    @DisplayName("generate: when the properties change the shape then the codes follow it")
    void shapeFollowsProperties() {
        VerificationProperties properties = new VerificationProperties();
        properties.setCodePrefix("RX");
        properties.setGroupCount(2);
        properties.setGroupSize(5);
        VerificationCodeGenerator custom = new VerificationCodeGenerator(properties);

        assertThat(custom.generate()).matches("RX-[0-9A-Z]{5}-[0-9A-Z]{5}");
    }
}
