package tokenacl.core.cache;

import java.util.Optional;

import tokenacl.core.model.access.RuleSet;

/**
 * Token-keyed store of compiled rule sets.
 *
 * <p>Keys are raw token strings used as opaque values. Implementations must be
 * safe for concurrent use and must never hand out an expired rule set from
 * {@link #find(String, long)}. Writes for the same token race; the last write
 * wins.
 */
public interface RuleSetStore {

    /**
     * Look up an unexpired rule set.
     *
     * @param token the raw token
     * @param now   current coarse monotonic time, in seconds
     * @return the rule set, or empty if absent or expired
     */
    Optional<RuleSet> find(String token, long now);

    /**
     * Store a rule set, replacing any existing entry for the token.
     */
    void put(String token, RuleSet ruleSet);

    /**
     * Remove the entry for a token.
     *
     * @return true if an entry was removed
     */
    boolean invalidate(String token);

    /**
     * Remove every entry.
     *
     * @return number of entries removed
     */
    int invalidateAll();

    /**
     * Remove every entry that is expired at {@code now}.
     *
     * @param now current coarse monotonic time, in seconds
     * @return number of entries removed
     */
    int sweepExpired(long now);

    /**
     * Number of entries currently held, expired ones included until swept.
     */
    int size();
}
