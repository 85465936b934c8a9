package tokenacl.core.cache;

import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import tokenacl.core.model.access.RuleSet;
import tokenacl.core.port.out.MonotonicClock;

/**
 * Caffeine-backed rule set store with per-entry expiry and a size bound.
 *
 * <p>Each entry expires when its own {@link RuleSet#expiry()} passes, measured
 * on the same coarse clock the decision path uses. Unlike
 * {@link LockingRuleSetStore}, readers never contend on a single lock and
 * the cache evicts the least recently used tokens once {@code maxEntries} is
 * reached.
 *
 * <p>Maintenance runs on the calling thread; sweeps and evictions are
 * visible as soon as the call returns.
 */
public final class CaffeineRuleSetStore implements RuleSetStore {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Cache<String, RuleSet> cache;

    /**
     * @param clock      coarse clock driving expiry
     * @param maxEntries maximum number of cached tokens
     */
    public CaffeineRuleSetStore(MonotonicClock clock, long maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(() -> clock.nowSeconds() * NANOS_PER_SECOND)
                .expireAfter(new RuleSetExpiry())
                .executor(Runnable::run)
                .build();
    }

    /**
     * Expiry policy deriving each entry's lifetime from its rule set.
     *
     * <p>A rule set is still valid in the second equal to its expiry, so the
     * entry lives until the start of the following second.
     */
    private static final class RuleSetExpiry implements Expiry<String, RuleSet> {
        @Override
        public long expireAfterCreate(String key, RuleSet value, long currentTime) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, RuleSet value, long currentTime, long currentDuration) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, RuleSet value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remaining(RuleSet value, long currentTime) {
            final var seconds = value.expiry() - Math.floorDiv(currentTime, NANOS_PER_SECOND) + 1;
            if (seconds <= 0) {
                return 0;
            }
            if (seconds > Long.MAX_VALUE / NANOS_PER_SECOND) {
                return Long.MAX_VALUE;
            }
            return seconds * NANOS_PER_SECOND;
        }
    }

    @Override
    public Optional<RuleSet> find(String token, long now) {
        final var ruleSet = cache.getIfPresent(token);
        if (ruleSet == null || ruleSet.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(ruleSet);
    }

    @Override
    public void put(String token, RuleSet ruleSet) {
        cache.put(token, ruleSet);
    }

    @Override
    public boolean invalidate(String token) {
        return cache.asMap().remove(token) != null;
    }

    @Override
    public int invalidateAll() {
        final var before = cache.estimatedSize();
        cache.invalidateAll();
        cache.cleanUp();
        return (int) Math.max(0, before - cache.estimatedSize());
    }

    @Override
    public int sweepExpired(long now) {
        final var before = cache.estimatedSize();
        cache.asMap().values().removeIf(ruleSet -> ruleSet.isExpired(now));
        cache.cleanUp();
        return (int) Math.max(0, before - cache.estimatedSize());
    }

    @Override
    public int size() {
        return (int) cache.estimatedSize();
    }
}
