package tokenacl.core.cache;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import tokenacl.core.model.access.RuleSet;

/**
 * Rule set store backed by a plain map behind a single lock.
 *
 * <p>The lock covers map access only. Expired entries are left in place until
 * they are overwritten or removed by {@link #sweepExpired(long)}, which holds
 * the lock for a full pass over the map.
 */
public final class LockingRuleSetStore implements RuleSetStore {

    private final Map<String, RuleSet> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public Optional<RuleSet> find(String token, long now) {
        lock.lock();
        try {
            final var ruleSet = entries.get(token);
            if (ruleSet == null || ruleSet.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(ruleSet);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String token, RuleSet ruleSet) {
        lock.lock();
        try {
            entries.put(token, ruleSet);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean invalidate(String token) {
        lock.lock();
        try {
            return entries.remove(token) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidateAll() {
        lock.lock();
        try {
            final var removed = entries.size();
            entries.clear();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int sweepExpired(long now) {
        lock.lock();
        try {
            final var before = entries.size();
            entries.values().removeIf(ruleSet -> ruleSet.isExpired(now));
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
