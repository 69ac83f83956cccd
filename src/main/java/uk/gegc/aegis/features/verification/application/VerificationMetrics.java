package uk.gegc.aegis.features.verification.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.verification.domain.model.CodeType;
import uk.gegc.aegis.features.verification.domain.model.RedemptionFailure;

import java.util.Locale;

/**
 * Micrometer counters for the code lifecycle. Failure counters are tagged with the same
 * reason string partners receive.
 */
@Component
public class VerificationMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter redeemedCounter;
    private final Counter expiredCounter;

    public VerificationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.redeemedCounter = Counter.builder("verification.codes.redeemed")
                .description("Codes consumed by a partner")
                .register(meterRegistry);
        this.expiredCounter = Counter.builder("verification.codes.expired")
                .description("Unused codes marked expired by the sweep")
                .register(meterRegistry);
    }

    public void recordIssued(CodeType type) {
        meterRegistry.counter("verification.codes.issued", "type", type.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordRedeemed() {
        redeemedCounter.increment();
    }

    public void recordRedeemFailed(RedemptionFailure failure) {
        meterRegistry.counter("verification.codes.redeem_failed", "reason", failure.value()).increment();
    }

    public void recordExpired(int count) {
        expiredCounter.increment(count);
    }
}
