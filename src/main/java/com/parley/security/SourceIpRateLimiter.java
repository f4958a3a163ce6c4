package com.parley.security;

import com.parley.config.ParleyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter per source IP. In-process only; each instance
 * enforces its own limit.
 */
public class SourceIpRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SourceIpRateLimiter.class);

    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public SourceIpRateLimiter(int maxRequests, Duration window, Clock clock) {
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    public SourceIpRateLimiter(ParleyProperties.RateLimitProperties properties, Clock clock) {
        this(properties.getMaxRequests(), properties.getWindow(), clock);
    }

    /**
     * Counts one request for the address and reports whether it is within the limit.
     * A non-positive limit disables the check.
     */
    public boolean tryAcquire(String sourceIp) {
        if (maxRequests <= 0 || sourceIp == null || sourceIp.isBlank()) return true;
        long now = clock.millis();
        Window window = windows.compute(sourceIp, (ip, current) ->
                current == null || now >= current.resetAt()
                        ? new Window(1, now + windowMillis)
                        : new Window(current.count() + 1, current.resetAt()));
        boolean allowed = window.count() <= maxRequests;
        if (!allowed && window.count() == maxRequests + 1) {
            log.warn("Inbound rate limit reached for sourceIp={} limit={}", sourceIp, maxRequests);
        }
        return allowed;
    }

    @Scheduled(fixedDelayString = "${parley.inbound.rate-limit.purge-interval-ms:300000}")
    public void purgeExpired() {
        long now = clock.millis();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> now >= entry.getValue().resetAt());
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Purged {} expired rate limit windows", removed);
        }
    }

    int trackedAddresses() {
        return windows.size();
    }

    private record Window(int count, long resetAt) {}
}
