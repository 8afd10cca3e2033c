package arcpay.guard.service.abuse;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Component;

/**
 * Process-local abuse store. State is lost on restart.
 */
@Component
public class InMemoryAbuseStore implements AbuseStore {

    private final Map<AbuseScope, ConcurrentHashMap<String, AbuseEntry>> entries = new EnumMap<>(AbuseScope.class);

    public InMemoryAbuseStore() {
        for (AbuseScope scope : AbuseScope.values()) {
            entries.put(scope, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Optional<AbuseEntry> find(AbuseScope scope, String key) {
        return Optional.ofNullable(entries.get(scope).get(key));
    }

    @Override
    public AbuseEntry compute(AbuseScope scope, String key, UnaryOperator<AbuseEntry> update) {
        return entries.get(scope).compute(key, (k, current) -> update.apply(current));
    }

    @Override
    public Optional<AbuseEntry> computeIfPresent(AbuseScope scope, String key, UnaryOperator<AbuseEntry> update) {
        return Optional.ofNullable(entries.get(scope).computeIfPresent(key, (k, current) -> update.apply(current)));
    }

    @Override
    public int removeIf(AbuseScope scope, Predicate<AbuseEntry> predicate) {
        ConcurrentHashMap<String, AbuseEntry> map = entries.get(scope);
        int removed = 0;
        for (Map.Entry<String, AbuseEntry> entry : map.entrySet()) {
            // conditional remove so an entry updated meanwhile survives
            if (predicate.test(entry.getValue()) && map.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size(AbuseScope scope) {
        return entries.get(scope).size();
    }
}
