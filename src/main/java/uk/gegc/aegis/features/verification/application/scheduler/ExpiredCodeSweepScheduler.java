package uk.gegc.aegis.features.verification.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.verification.application.VerificationCodeService;
import uk.gegc.aegis.features.verification.domain.repository.VerificationCodeRepository;
import uk.gegc.aegis.shared.tenant.TenantContextGuard;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredCodeSweepScheduler {

    static final String ACTOR = "system:expiry-sweep";

    private final VerificationCodeRepository codeRepository;
    private final VerificationCodeService verificationCodeService;
    private final TenantContextGuard tenantContextGuard;
    private final Clock clock;

    @Scheduled(cron = "${app.verification.sweep-cron:0 */15 * * * *}")
    public void sweepExpiredCodes() {
        List<UUID> tenants = codeRepository.findTenantsWithExpirableCodes(clock.instant());
        int total = 0;
        for (UUID tenantId : tenants) {
            try {
                total += verificationCodeService.markExpired(tenantContextGuard.bind(tenantId), ACTOR);
            } catch (Exception e) {
                log.error("Failed to expire verification codes for tenant {}", tenantId, e);
            }
        }
        if (total > 0) {
            log.info("Expiry sweep moved {} codes across {} tenants to expired", total, tenants.size());
        }
    }
}
