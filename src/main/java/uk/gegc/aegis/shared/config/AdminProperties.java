package uk.gegc.aegis.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * The single operator account behind the admin endpoints.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.admin")
public class AdminProperties {

    private String username = "operator";

    /**
     * Encoded password, either a bcrypt hash or a {@code {noop}} value for local use.
     */
    private String password;
}
