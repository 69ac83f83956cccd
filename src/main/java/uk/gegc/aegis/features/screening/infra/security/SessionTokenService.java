package uk.gegc.aegis.features.screening.infra.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.screening.config.SessionTokenProperties;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class SessionTokenService {

    static final String TOKEN_TYPE = "screening_session";
    private static final String TYPE_CLAIM = "type";
    private static final String TENANT_CLAIM = "tid";

    private final SessionTokenProperties properties;
    private final Clock clock;

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(properties.getSecret());
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public IssuedSessionToken issue(UUID sessionId, UUID tenantId) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(properties.getExpirationMs());

        String token = Jwts.builder()
                .subject(sessionId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(TYPE_CLAIM, TOKEN_TYPE)
                .claim(TENANT_CLAIM, tenantId.toString())
                .signWith(key)
                .compact();
        return new IssuedSessionToken(token, expiry);
    }

    /**
     * Returns the principal for a valid, unexpired session token, or empty for anything else.
     */
    public Optional<ScreeningSessionPrincipal> parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (!TOKEN_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
                log.warn("Rejected bearer token with unexpected type claim");
                return Optional.empty();
            }
            String tenant = claims.get(TENANT_CLAIM, String.class);
            if (claims.getSubject() == null || tenant == null) {
                log.warn("Rejected session token missing subject or tenant");
                return Optional.empty();
            }
            return Optional.of(new ScreeningSessionPrincipal(
                    UUID.fromString(claims.getSubject()), UUID.fromString(tenant)));
        } catch (ExpiredJwtException ex) {
            log.debug("Session token is expired: {}", ex.getMessage());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Invalid session token: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public record IssuedSessionToken(String token, Instant expiresAt) {
    }
}
