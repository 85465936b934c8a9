package tokenacl.core.port.out;

import tokenacl.core.model.access.DecisionOutcome;

/**
 * Port interface for recording authorization metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AuthorizationMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the authority that answered a decision.
     *
     * @param outcome the deciding authority
     */
    void recordDecision(DecisionOutcome outcome);

    /**
     * Record a cache lookup for a token.
     *
     * @param hit true if an unexpired rule set was found
     */
    void recordCacheLookup(boolean hit);

    /**
     * Record a token that could not be turned into rules.
     *
     * @param reason one of {@code invalid}, {@code error}, {@code timeout}
     */
    void recordValidationFailure(String reason);

    /**
     * Record a completed sweep of expired entries.
     *
     * @param removed number of entries removed
     */
    void recordSweep(int removed);
}
