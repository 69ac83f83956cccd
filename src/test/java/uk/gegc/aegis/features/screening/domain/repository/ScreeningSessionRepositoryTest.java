package uk.gegc.aegis.features.screening.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.features.screening.domain.model.ScreeningPath;
import uk.gegc.aegis.features.screening.domain.model.ScreeningSession;
import uk.gegc.aegis.features.screening.domain.model.SessionStatus;
import uk.gegc.aegis.shared.tenant.TenantContext;
import uk.gegc.aegis.testsupport.TestTenants;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ScreeningSessionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    @Autowired
    private ScreeningSessionRepository sessionRepository;

    private final TenantContext tenantA = TestTenants.tenantA();
    private final TenantContext tenantB = TestTenants.tenantB();

    private ScreeningSession started(TenantContext tenant) {
        return sessionRepository.saveAndFlush(ScreeningSession.start(
                tenant, UUID.randomUUID(), UUID.randomUUID(), ScreeningPath.MANUAL, NOW));
    }

    @Test
    @DisplayName("findById: when the session belongs to another tenant then it is not visible")
    void tenantIsolation() {
        ScreeningSession session = started(tenantA);

        assertThat(sessionRepository.findById(tenantA, session.getId())).isPresent();
        assertThat(sessionRepository.findById(tenantB, session.getId())).isEmpty();
    }

    @Test
    @DisplayName("completeIfStarted: when called twice then only the first call completes the session")
    void completesOnce() {
        ScreeningSession session = started(tenantA);

        int first = sessionRepository.completeIfStarted(tenantA, session.getId(), "{\"age_check\":true}",
                Outcome.ELIGIBLE, NOW.plusSeconds(60));
        int second = sessionRepository.completeIfStarted(tenantA, session.getId(), "{\"age_check\":false}",
                Outcome.INELIGIBLE, NOW.plusSeconds(120));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        ScreeningSession stored = sessionRepository.findById(tenantA, session.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(stored.getOutcome()).isEqualTo(Outcome.ELIGIBLE);
        assertThat(stored.getAnswers()).isEqualTo("{\"age_check\":true}");
        assertThat(stored.getCompletedAt()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    @DisplayName("completeIfStarted: when issued under another tenant then nothing changes")
    void completeOtherTenant() {
        ScreeningSession session = started(tenantA);

        assertThat(sessionRepository.completeIfStarted(tenantB, session.getId(), "{}", Outcome.ELIGIBLE, NOW)).isZero();
        assertThat(sessionRepository.findById(tenantA, session.getId()).orElseThrow().getStatus())
                .isEqualTo(SessionStatus.STARTED);
    }

    @Test
    @DisplayName("isEligibleForCode: when only an eligible completed session qualifies then others do not")
    void eligibility() {
        ScreeningSession eligible = started(tenantA);
        ScreeningSession consult = started(tenantA);
        ScreeningSession open = started(tenantA);
        sessionRepository.completeIfStarted(tenantA, eligible.getId(), "{}", Outcome.ELIGIBLE, NOW);
        sessionRepository.completeIfStarted(tenantA, consult.getId(), "{}", Outcome.CONSULT_PROFESSIONAL, NOW);

        assertThat(sessionRepository.isEligibleForCode(tenantA, eligible.getId())).isTrue();
        assertThat(sessionRepository.isEligibleForCode(tenantB, eligible.getId())).isFalse();
        assertThat(sessionRepository.isEligibleForCode(tenantA, consult.getId())).isFalse();
        assertThat(sessionRepository.isEligibleForCode(tenantA, open.getId())).isFalse();
    }
}
