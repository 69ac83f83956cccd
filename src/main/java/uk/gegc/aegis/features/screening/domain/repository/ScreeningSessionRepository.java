package uk.gegc.aegis.features.screening.domain.repository;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.features.screening.domain.model.ScreeningSession;
import uk.gegc.aegis.shared.tenant.TenantContext;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ScreeningSessionRepository extends Repository<ScreeningSession, UUID> {

    ScreeningSession saveAndFlush(ScreeningSession session);

    @Query("SELECT s FROM ScreeningSession s WHERE s.id = :id AND s.tenantId = :#{#tenant.tenantId}")
    Optional<ScreeningSession> findById(@Param("tenant") TenantContext tenant, @Param("id") UUID id);

    /**
     * Completes a started session. Returns 0 when the session is missing or already completed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE ScreeningSession s
            SET s.answers = :answers,
                s.outcome = :outcome,
                s.status = uk.gegc.aegis.features.screening.domain.model.SessionStatus.COMPLETED,
                s.completedAt = :completedAt
            WHERE s.id = :id
              AND s.tenantId = :#{#tenant.tenantId}
              AND s.status = uk.gegc.aegis.features.screening.domain.model.SessionStatus.STARTED
            """)
    int completeIfStarted(@Param("tenant") TenantContext tenant,
                          @Param("id") UUID id,
                          @Param("answers") String answers,
                          @Param("outcome") Outcome outcome,
                          @Param("completedAt") Instant completedAt);

    @Query("""
            SELECT CASE WHEN COUNT(s) > 0 THEN true ELSE false END
            FROM ScreeningSession s
            WHERE s.id = :id
              AND s.tenantId = :#{#tenant.tenantId}
              AND s.status = uk.gegc.aegis.features.screening.domain.model.SessionStatus.COMPLETED
              AND s.outcome = uk.gegc.aegis.features.questionnaire.domain.model.Outcome.ELIGIBLE
            """)
    boolean isEligibleForCode(@Param("tenant") TenantContext tenant, @Param("id") UUID id);
}
