package uk.gegc.aegis.features.screening.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Signing settings for the bearer tokens handed to patients when a screening session starts.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.session-token")
public class SessionTokenProperties {

    /**
     * Base64-encoded HMAC key, at least 256 bits once decoded.
     */
    private String secret;

    /**
     * Token lifetime. Default: 1 hour
     */
    private long expirationMs = 3_600_000L;
}
