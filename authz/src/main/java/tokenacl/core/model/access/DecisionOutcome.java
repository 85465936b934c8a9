package tokenacl.core.model.access;

/**
 * Which authority produced the final answer of a decision.
 */
public enum DecisionOutcome {
    /** The token's cached rules granted at least one privilege. */
    RULES,
    /** The chained authorizer was consulted. */
    CHAIN,
    /** Nobody had an opinion and no chain is configured. */
    NONE
}
