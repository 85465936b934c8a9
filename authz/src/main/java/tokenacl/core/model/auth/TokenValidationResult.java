package tokenacl.core.model.auth;

import java.util.List;

import tokenacl.core.model.access.AccessRule;

/**
 * Result of turning a raw token into permission rules.
 */
public sealed interface TokenValidationResult {

    /**
     * Token was accepted.
     *
     * @param lifetimeSeconds how long the derived rules may be cached
     * @param rules           the permission rules the token carries
     * @param identity        subject the token represents, empty if not asserted
     */
    record Valid(long lifetimeSeconds, List<AccessRule> rules, String identity) implements TokenValidationResult {
        public Valid {
            if (lifetimeSeconds < 0) {
                throw new IllegalArgumentException("Lifetime cannot be negative: " + lifetimeSeconds);
            }
            rules = rules == null ? List.of() : List.copyOf(rules);
            if (identity == null) {
                identity = "";
            }
        }
    }

    /**
     * Token is not in a format this validator understands.
     */
    record NotApplicable() implements TokenValidationResult {}

    /**
     * Token is in a recognised format but was rejected.
     *
     * @param reason description of why validation failed
     */
    record Invalid(String reason) implements TokenValidationResult {}
}
