package tokenacl.core.model.access;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Request attributes handed to the authorization layer alongside the path.
 *
 * <p>The credential token travels as the {@value #TOKEN_ATTRIBUTE} attribute.
 * All attributes are passed unchanged to the chained authorizer.
 *
 * @param attributes immutable attribute map
 */
public record AccessContext(Map<String, String> attributes) {

    public static final String TOKEN_ATTRIBUTE = "authz";

    private static final AccessContext EMPTY = new AccessContext(Map.of());

    public AccessContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static AccessContext empty() {
        return EMPTY;
    }

    /**
     * A context carrying only a token.
     */
    public static AccessContext withToken(String token) {
        if (token == null) {
            return EMPTY;
        }
        return new AccessContext(Map.of(TOKEN_ATTRIBUTE, token));
    }

    /**
     * Copy of this context with the token attribute replaced.
     */
    public AccessContext withTokenAttribute(String token) {
        final var copy = new HashMap<>(attributes);
        if (token == null) {
            copy.remove(TOKEN_ATTRIBUTE);
        } else {
            copy.put(TOKEN_ATTRIBUTE, token);
        }
        return new AccessContext(copy);
    }

    /**
     * The credential token, if the request carried a non-empty one.
     */
    public Optional<String> token() {
        final var token = attributes.get(TOKEN_ATTRIBUTE);
        return token == null || token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
