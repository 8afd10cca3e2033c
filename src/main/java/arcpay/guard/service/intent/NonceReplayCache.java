package arcpay.guard.service.intent;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import arcpay.guard.config.X402Properties;
import arcpay.guard.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory replay protection for x402 intents: nonce -> time it was consumed.
 * Swept every {@code x402.nonce-sweep-every} registrations and on a fixed delay.
 */
@Component
@Slf4j
public class NonceReplayCache implements NonceStore {

    private final Map<String, Instant> consumed = new ConcurrentHashMap<>();
    private final AtomicLong registrations = new AtomicLong();
    private final X402Properties properties;
    private final Clock clock;

    public NonceReplayCache(X402Properties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean register(String nonce) {
        if (nonce == null || nonce.isBlank()) {
            return false;
        }
        Instant previous = consumed.putIfAbsent(nonce, clock.instant());
        if (previous != null) {
            log.warn("Replay detected for nonce {} (first seen {})", LogSanitizer.maskIdentifier(nonce), previous);
            return false;
        }
        int sweepEvery = Math.max(1, properties.getNonceSweepEvery());
        if (registrations.incrementAndGet() % sweepEvery == 0) {
            sweep();
        }
        return true;
    }

    @Override
    @Scheduled(fixedDelayString = "${x402.nonce-sweep-interval-ms:300000}")
    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.getNonceRetention());
        int removed = 0;
        for (Map.Entry<String, Instant> entry : consumed.entrySet()) {
            Instant consumedAt = entry.getValue();
            // Only drop the exact stale value; a concurrent re-insert survives.
            if (consumedAt.isBefore(cutoff) && consumed.remove(entry.getKey(), consumedAt)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired nonces, {} remaining", removed, consumed.size());
        }
        return removed;
    }

    @Override
    public int size() {
        return consumed.size();
    }
}
