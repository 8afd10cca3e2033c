package arcpay.guard.service.abuse;

import java.time.Duration;
import java.time.Instant;

/**
 * Failure bookkeeping for one IP or user key.
 *
 * @param count        failures seen in the current window
 * @param windowStart  start of the current counting window
 * @param blocked      whether the key is denied
 * @param blockedUntil the single unblock deadline of the key, null when unblocked
 */
public record AbuseEntry(int count, Instant windowStart, boolean blocked, Instant blockedUntil) {

    static AbuseEntry fresh(Instant now) {
        return new AbuseEntry(0, now, false, null);
    }

    AbuseEntry resetWindow(Instant now) {
        return new AbuseEntry(0, now, blocked, blockedUntil);
    }

    AbuseEntry incremented() {
        return new AbuseEntry(count + 1, windowStart, blocked, blockedUntil);
    }

    AbuseEntry withBlock(Instant deadline) {
        return new AbuseEntry(count, windowStart, true, deadline);
    }

    AbuseEntry unblocked() {
        return new AbuseEntry(count, windowStart, false, null);
    }

    public boolean windowElapsed(Instant now, Duration window) {
        return Duration.between(windowStart, now).compareTo(window) > 0;
    }

    /**
     * A block whose deadline has passed no longer denies, even before the
     * scheduled unblock has flipped the flag.
     */
    public boolean isBlockedAt(Instant now) {
        return blocked && (blockedUntil == null || now.isBefore(blockedUntil));
    }
}
