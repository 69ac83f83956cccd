package uk.gegc.aegis.features.verification.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app.verification")
public class VerificationProperties {

    /**
     * Brand prefix printed before the code groups.
     */
    private String codePrefix = "AEGIS";

    private int groupCount = 3;

    private int groupSize = 4;

    /**
     * Collision probes before issuance gives up.
     */
    private int maxGenerationAttempts = 5;

    private int defaultTtlHours = 72;

    private int maxTtlHours = 720;

    /**
     * Executions of the conditional redeem statement per request, counting the first.
     */
    private int maxRedeemAttempts = 3;

    private String sweepCron = "0 */15 * * * *";
}
