package uk.gegc.aegis.shared.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.aegis.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed one-minute window limiter keyed by operation and caller.
 * State is per process; partners hitting several nodes get the limit per node.
 */
@Service
@RequiredArgsConstructor
public class RateLimitService {

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public void checkRateLimit(String operation, String key, int limitPerMinute) {
        String rateLimitKey = operation + ":" + key;
        Instant now = clock.instant();
        Instant oneMinuteAgo = now.minus(Duration.ofMinutes(1));

        windows.entrySet().removeIf(entry -> !entry.getValue().startedAt().isAfter(oneMinuteAgo));

        Window window = windows.compute(rateLimitKey, (k, current) -> {
            if (current == null || !current.startedAt().isAfter(oneMinuteAgo)) {
                return new Window(now, 1);
            }
            return new Window(current.startedAt(), current.count() + 1);
        });

        if (window.count() > limitPerMinute) {
            long retryAfter = Duration.between(now, window.startedAt().plus(Duration.ofMinutes(1))).getSeconds();
            throw new RateLimitExceededException("Too many requests for " + operation, retryAfter);
        }
    }

    private record Window(Instant startedAt, int count) {
    }
}
