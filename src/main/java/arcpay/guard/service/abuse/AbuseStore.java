package arcpay.guard.service.abuse;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Storage boundary for abuse entries. Implementations must apply
 * {@link #compute} atomically per key; an external TTL store can replace the
 * in-memory default.
 */
public interface AbuseStore {

    Optional<AbuseEntry> find(AbuseScope scope, String key);

    /**
     * Atomically replaces the entry for {@code key}. The update receives null
     * when no entry exists and must return a non-null entry. It runs exactly
     * once, while other updates of the same key wait.
     */
    AbuseEntry compute(AbuseScope scope, String key, UnaryOperator<AbuseEntry> update);

    /**
     * Atomically replaces an existing entry; does nothing when absent.
     */
    Optional<AbuseEntry> computeIfPresent(AbuseScope scope, String key, UnaryOperator<AbuseEntry> update);

    /**
     * Removes every entry of the scope matching {@code predicate}.
     *
     * @return number of removed entries
     */
    int removeIf(AbuseScope scope, Predicate<AbuseEntry> predicate);

    int size(AbuseScope scope);
}
