package tokenacl.core.model.access;

import java.util.List;

/**
 * The permissions a credential held when it was validated.
 *
 * <p>Built once from the validator's output and never mutated afterwards, so
 * a single instance is safely shared by every request presenting the same
 * token until {@link #isExpired(long)} turns true.
 *
 * <p>Matching is cumulative: {@link #apply(Operation, String)} unions the
 * privileges of every rule whose prefix matches the path. The requested
 * operation does not filter the rules; each matching rule contributes the
 * privilege of the operation it was recorded under.
 */
public final class RuleSet {

    private final long expiry;
    private final String identity;
    private final List<AccessRule> rules;

    /**
     * @param expiry   absolute coarse monotonic time, in seconds, after which the set is invalid
     * @param identity subject the token represents, empty if not asserted
     * @param rules    rules in the order the validator produced them
     */
    public RuleSet(long expiry, String identity, List<AccessRule> rules) {
        this.expiry = expiry;
        this.identity = identity == null ? "" : identity;
        this.rules = List.copyOf(rules);
    }

    /**
     * Union of the privileges of every rule whose prefix matches {@code path}.
     *
     * @param operation the requested operation (not used to filter rules)
     * @param path      the requested path
     * @return accumulated privileges, {@link Privileges#NONE} when nothing matched
     */
    public Privileges apply(Operation operation, String path) {
        var privileges = Privileges.NONE;
        for (AccessRule rule : rules) {
            if (rule.matches(path)) {
                privileges = PrivilegeMapper.accumulate(rule.operation(), privileges);
            }
        }
        return privileges;
    }

    /**
     * @param now current coarse monotonic time, in seconds
     * @return true once {@code now} is strictly after the expiry
     */
    public boolean isExpired(long now) {
        return now > expiry;
    }

    public long expiry() {
        return expiry;
    }

    public String identity() {
        return identity;
    }

    public List<AccessRule> rules() {
        return rules;
    }

    @Override
    public String toString() {
        return "RuleSet{expiry=" + expiry + ", identity='" + identity + "', rules=" + rules.size() + "}";
    }
}
