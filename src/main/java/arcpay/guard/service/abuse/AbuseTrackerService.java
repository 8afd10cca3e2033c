package arcpay.guard.service.abuse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import arcpay.guard.config.AbuseProperties;
import arcpay.guard.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks failed requests per IP and per user, blocks keys that cross the
 * threshold and lifts blocks once their deadline passes.
 * <p>
 * Each key carries a single unblock deadline. A newer block replaces it and
 * cancels the previously scheduled unblock; an unblock task whose deadline
 * was superseded leaves the entry alone. Pending unblocks are swapped inside
 * the store update of their key, so their order always matches the order of
 * the deadlines written to the store.
 */
@Service
@Slf4j
public class AbuseTrackerService {

    static final String IP_BLOCK_REASON = "IP address is blocked due to abuse";
    static final String USER_BLOCK_REASON = "User account is blocked due to abuse";

    private final AbuseStore store;
    private final AbuseProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, PendingUnblock> pendingUnblocks = new ConcurrentHashMap<>();

    @Autowired
    public AbuseTrackerService(AbuseStore store, AbuseProperties properties, Clock clock) {
        this(store, properties, clock, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "abuse-unblock-scheduler");
            t.setDaemon(true);
            return t;
        }));
    }

    AbuseTrackerService(AbuseStore store, AbuseProperties properties, Clock clock, ScheduledExecutorService scheduler) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void init() {
        long intervalMs = properties.getCleanupInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::evictIdleEntries, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /**
     * Counts one failure against the caller's IP and, when known, its user id.
     * Crossing the threshold blocks the key; nothing is thrown to the caller.
     */
    public void recordFailure(ClientIdentity identity, String reason) {
        if (identity == null) {
            return;
        }
        Instant now = clock.instant();
        AbuseEntry ipEntry = registerFailure(AbuseScope.IP, identity.ip(), reason, now);
        AbuseEntry userEntry = identity.hasUser()
            ? registerFailure(AbuseScope.USER, identity.userId(), reason, now)
            : null;

        log.debug("Failure tracked: ip={}, user={}, reason={}, ipCount={}, userCount={}",
            LogSanitizer.maskIp(identity.ip()),
            LogSanitizer.maskIdentifier(identity.userId()),
            LogSanitizer.sanitize(reason),
            ipEntry.count(),
            userEntry != null ? userEntry.count() : 0);
    }

    /**
     * Checks the IP first, then the user. Either block denies.
     */
    public BlockStatus isBlocked(ClientIdentity identity) {
        if (identity == null) {
            return BlockStatus.allowed();
        }
        Instant now = clock.instant();
        if (store.find(AbuseScope.IP, identity.ip()).map(e -> e.isBlockedAt(now)).orElse(false)) {
            return BlockStatus.denied(IP_BLOCK_REASON);
        }
        if (identity.hasUser()
            && store.find(AbuseScope.USER, identity.userId()).map(e -> e.isBlockedAt(now)).orElse(false)) {
            return BlockStatus.denied(USER_BLOCK_REASON);
        }
        return BlockStatus.allowed();
    }

    /**
     * Blocks the IP and user keys for {@code duration}. The latest call sets the deadline.
     */
    public void block(ClientIdentity identity, Duration duration) {
        Duration effective = (duration == null || duration.isNegative() || duration.isZero())
            ? properties.getDefaultBlockDuration()
            : duration;
        Instant now = clock.instant();
        Instant deadline = now.plus(effective);

        applyBlock(AbuseScope.IP, identity.ip(), now, deadline);
        if (identity.hasUser()) {
            applyBlock(AbuseScope.USER, identity.userId(), now, deadline);
        }
        log.warn("Client blocked: ip={}, user={}, duration={}s",
            LogSanitizer.maskIp(identity.ip()),
            LogSanitizer.maskIdentifier(identity.userId()),
            effective.toSeconds());
    }

    public void unblock(ClientIdentity identity) {
        releaseNow(AbuseScope.IP, identity.ip());
        if (identity.hasUser()) {
            releaseNow(AbuseScope.USER, identity.userId());
        }
        log.info("Client unblocked: ip={}, user={}",
            LogSanitizer.maskIp(identity.ip()), LogSanitizer.maskIdentifier(identity.userId()));
    }

    public AbuseSnapshot snapshot(ClientIdentity identity) {
        AbuseEntry ipEntry = store.find(AbuseScope.IP, identity.ip()).orElse(null);
        AbuseEntry userEntry = identity.hasUser()
            ? store.find(AbuseScope.USER, identity.userId()).orElse(null)
            : null;
        return new AbuseSnapshot(identity.ip(), identity.userId(), isBlocked(identity), ipEntry, userEntry);
    }

    /**
     * Drops entries that no longer deny and whose window has elapsed. Such an
     * entry behaves exactly like an absent one. A block whose deadline passed
     * counts as lifted even if its unblock task has not run.
     */
    public int evictIdleEntries() {
        Instant now = clock.instant();
        Duration window = properties.getWindow();
        int removed = 0;
        for (AbuseScope scope : AbuseScope.values()) {
            removed += store.removeIf(scope, entry -> !entry.isBlockedAt(now) && entry.windowElapsed(now, window));
        }
        if (removed > 0) {
            log.info("Evicted {} idle abuse entries", removed);
        }
        return removed;
    }

    private AbuseEntry registerFailure(AbuseScope scope, String key, String reason, Instant now) {
        AtomicBoolean newlyBlocked = new AtomicBoolean(false);
        Instant deadline = now.plus(properties.getDefaultBlockDuration());

        AbuseEntry updated = store.compute(scope, key, current -> {
            AbuseEntry entry = current == null ? AbuseEntry.fresh(now) : current;
            if (entry.windowElapsed(now, properties.getWindow())) {
                entry = entry.resetWindow(now);
            }
            entry = entry.incremented();
            if (entry.count() >= properties.getThreshold() && !entry.isBlockedAt(now)) {
                newlyBlocked.set(true);
                entry = entry.withBlock(deadline);
                scheduleUnblock(scope, key, deadline);
            }
            return entry;
        });

        if (newlyBlocked.get()) {
            log.warn("Auto-blocked {} {} after {} failed requests (last reason: {})",
                scope == AbuseScope.IP ? "IP" : "user",
                scope == AbuseScope.IP ? LogSanitizer.maskIp(key) : LogSanitizer.maskIdentifier(key),
                updated.count(),
                LogSanitizer.sanitize(reason));
        }
        return updated;
    }

    private void applyBlock(AbuseScope scope, String key, Instant now, Instant deadline) {
        store.compute(scope, key, current -> {
            AbuseEntry blocked = (current == null ? AbuseEntry.fresh(now) : current).withBlock(deadline);
            scheduleUnblock(scope, key, deadline);
            return blocked;
        });
    }

    // Called from within the store update of the key
    private void scheduleUnblock(AbuseScope scope, String key, Instant deadline) {
        long delayMs = Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
        ScheduledFuture<?> future = scheduler.schedule(
            () -> expireBlock(scope, key, deadline), delayMs, TimeUnit.MILLISECONDS);
        PendingUnblock previous = pendingUnblocks.put(pendingKey(scope, key), new PendingUnblock(deadline, future));
        if (previous != null) {
            previous.future().cancel(false);
        }
    }

    /**
     * Lifts the block only if {@code deadline} is still the key's current one.
     */
    void expireBlock(AbuseScope scope, String key, Instant deadline) {
        AtomicBoolean released = new AtomicBoolean(false);
        store.computeIfPresent(scope, key, entry -> {
            if (!entry.blocked() || !deadline.equals(entry.blockedUntil())) {
                return entry;
            }
            released.set(true);
            return entry.unblocked();
        });
        pendingUnblocks.computeIfPresent(pendingKey(scope, key),
            (k, pending) -> pending.deadline().equals(deadline) ? null : pending);
        if (released.get()) {
            log.info("Timed block expired for {} {}", scope,
                scope == AbuseScope.IP ? LogSanitizer.maskIp(key) : LogSanitizer.maskIdentifier(key));
        }
    }

    private void releaseNow(AbuseScope scope, String key) {
        store.computeIfPresent(scope, key, entry -> {
            PendingUnblock pending = pendingUnblocks.remove(pendingKey(scope, key));
            if (pending != null) {
                pending.future().cancel(false);
            }
            return entry.unblocked();
        });
    }

    private static String pendingKey(AbuseScope scope, String key) {
        return scope.name() + ":" + key;
    }

    private record PendingUnblock(Instant deadline, ScheduledFuture<?> future) { }
}
