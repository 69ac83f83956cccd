package uk.gegc.aegis.features.screening.infra.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.aegis.features.screening.config.SessionTokenProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTokenServiceTest {

    private static final String SECRET = "dGVzdC1zZXNzaW9uLXRva2VuLXNpZ25pbmcta2V5LWZvci11bml0LXRlc3RzLW9ubHk=";
    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private SessionTokenProperties properties;
    private SessionTokenService service;

    @BeforeEach
    void setUp() {
        properties = new SessionTokenProperties();
        properties.setSecret(SECRET);
        properties.setExpirationMs(Duration.ofMinutes(30).toMillis());
        service = serviceAt(NOW);
    }

    private SessionTokenService serviceAt(Instant instant) {
        SessionTokenService tokenService = new SessionTokenService(properties, Clock.fixed(instant, ZoneOffset.UTC));
        tokenService.init();
        return tokenService;
    }

    @Test
    @DisplayName("issue: when a token is parsed back then it yields the session and tenant")
    void issueThenParse() {
        UUID sessionId = UUID.randomUUID();
        UUID tenantId = UUID.randomUUID();

        SessionTokenService.IssuedSessionToken issued = service.issue(sessionId, tenantId);
        Optional<ScreeningSessionPrincipal> principal = service.parse(issued.token());

        assertThat(issued.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        assertThat(principal).contains(new ScreeningSessionPrincipal(sessionId, tenantId));
    }

    @Test
    @DisplayName("parse: when the token has expired then it is rejected")
    void expiredRejected() {
        String token = service.issue(UUID.randomUUID(), UUID.randomUUID()).token();

        assertThat(serviceAt(NOW.plus(Duration.ofMinutes(31))).parse(token)).isEmpty();
    }

    @Test
    @DisplayName("parse: when the token is signed with another key then it is rejected")
    void foreignSignatureRejected() {
        SessionTokenProperties other = new SessionTokenProperties();
        other.setSecret("b3RoZXItc2Vzc2lvbi10b2tlbi1zaWduaW5nLWtleS1mb3ItdW5pdC10ZXN0cy1vbmx5");
        SessionTokenService foreign = new SessionTokenService(other, Clock.fixed(NOW, ZoneOffset.UTC));
        foreign.init();

        String token = foreign.issue(UUID.randomUUID(), UUID.randomUUID()).token();

        assertThat(service.parse(token)).isEmpty();
    }

    @Test
    @DisplayName("parse: when a validly signed token has another type claim then it is rejected")
    void wrongTypeRejected() {
        String token = Jwts.builder()
                .subject(UUID.randomUUID().toString())
                .claim("type", "something_else")
                .claim("tid", UUID.randomUUID().toString())
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(Decoders.BASE64.decode(SECRET)))
                .compact();

        assertThat(service.parse(token)).isEmpty();
    }

    @Test
    @DisplayName("parse: when the input is not a token then it is rejected")
    void garbageRejected() {
        assertThat(service.parse("not-a-jwt")).isEmpty();
        assertThat(service.parse("")).isEmpty();
    }
}
