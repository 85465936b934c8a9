package tokenacl.spi;

import tokenacl.core.model.access.AccessContext;
import tokenacl.core.model.access.AccessEntity;
import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.Privileges;

/**
 * Service Provider Interface for the authorizer consulted when token rules
 * have no opinion.
 *
 * <p>The chain is asked when a request carries no token, when its token is
 * not applicable or rejected, and when the token's rules grant nothing on the
 * requested path. Its answer is returned as is.
 *
 * <p>When several implementations are available, the one with the highest
 * priority is used.
 */
public interface ChainedAuthorizer {

    /**
     * Unique name identifying this authorizer.
     */
    String name();

    /**
     * Priority for selection (higher wins).
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this authorizer is configured and should be used.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Decide the privileges of a request.
     *
     * @param entity    the request subject
     * @param path      the requested path
     * @param operation the requested operation
     * @param context   request attributes
     * @return granted privileges, {@link Privileges#NONE} if none
     */
    Privileges decide(AccessEntity entity, String path, Operation operation, AccessContext context);
}
