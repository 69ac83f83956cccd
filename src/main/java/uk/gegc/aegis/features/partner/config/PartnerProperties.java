package uk.gegc.aegis.features.partner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app.partner")
public class PartnerProperties {

    private String apiKeyHeader = "X-API-Key";

    /**
     * Verify and check calls allowed per partner per minute.
     */
    private int verifyRateLimitPerMinute = 120;
}
