package tokenacl.core.model.access;

/**
 * A single path-prefix permission: {@code operation} is granted on every path
 * starting with {@code pathPrefix}.
 *
 * <p>Prefix comparison is literal. No case folding, no trailing-slash or
 * dot-segment normalization: {@code /data} matches {@code /database}.
 *
 * @param operation  the operation this rule was recorded under
 * @param pathPrefix the literal path prefix; an empty prefix matches every path
 */
public record AccessRule(Operation operation, String pathPrefix) {

    private static final char SCOPE_SEPARATOR = ':';

    public AccessRule {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null");
        }
        if (pathPrefix == null) {
            throw new IllegalArgumentException("Path prefix cannot be null");
        }
    }

    /**
     * Whether the given path starts with this rule's prefix.
     */
    public boolean matches(String path) {
        return path != null && path.startsWith(pathPrefix);
    }

    /**
     * Parse a scope string of the form {@code operation:prefix}, e.g. {@code read:/data/}.
     *
     * <p>Only the first colon separates operation from prefix; the prefix may
     * itself contain colons.
     *
     * @param scope the scope string
     * @return the parsed rule
     * @throws IllegalArgumentException if the scope is malformed
     */
    public static AccessRule parse(String scope) {
        if (scope == null) {
            throw new IllegalArgumentException("Scope cannot be null");
        }
        final var trimmed = scope.trim();
        final var separator = trimmed.indexOf(SCOPE_SEPARATOR);
        if (separator <= 0) {
            throw new IllegalArgumentException("Scope must have the form operation:prefix, got: " + scope);
        }
        if (separator == trimmed.length() - 1) {
            throw new IllegalArgumentException("Scope must have a non-empty path prefix, got: " + scope);
        }
        final var operation = Operation.fromName(trimmed.substring(0, separator));
        return new AccessRule(operation, trimmed.substring(separator + 1));
    }

    /**
     * Scope string form of this rule.
     */
    public String toScope() {
        return operation.value() + SCOPE_SEPARATOR + pathPrefix;
    }
}
