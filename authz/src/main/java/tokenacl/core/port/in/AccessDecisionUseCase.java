package tokenacl.core.port.in;

import tokenacl.core.model.access.AccessContext;
import tokenacl.core.model.access.AccessEntity;
import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.Privileges;

/**
 * Use case for deciding what a request may do on a path.
 */
public interface AccessDecisionUseCase {

    /**
     * Decide the privileges a request holds on {@code path}.
     *
     * <p>May assign a name to {@code entity} when the request's token asserts
     * an identity and the host has not set one.
     *
     * @param entity    the request subject; its name may be assigned
     * @param path      the requested path
     * @param operation the requested operation
     * @param context   request attributes, including the optional token
     * @return granted privileges, {@link Privileges#NONE} when nobody grants anything
     */
    Privileges decide(AccessEntity entity, String path, Operation operation, AccessContext context);
}
