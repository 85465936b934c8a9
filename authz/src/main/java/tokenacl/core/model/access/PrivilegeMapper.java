package tokenacl.core.model.access;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed table from {@link Operation} to the privilege it implies.
 *
 * <p>{@link Operation#ANY} maps to {@link Privileges#NONE}: a rule recorded
 * under {@code ANY} still matches paths, but adds nothing to the accumulated
 * mask. {@link Operation#STAT} maps to {@link Privilege#LOOKUP}; every other
 * operation maps to the privilege of the same name.
 */
public final class PrivilegeMapper {

    private static final Map<Operation, Privileges> TABLE;

    static {
        final var table = new EnumMap<Operation, Privileges>(Operation.class);
        table.put(Operation.ANY, Privileges.NONE);
        table.put(Operation.CHMOD, Privileges.of(Privilege.CHMOD));
        table.put(Operation.CHOWN, Privileges.of(Privilege.CHOWN));
        table.put(Operation.CREATE, Privileges.of(Privilege.CREATE));
        table.put(Operation.DELETE, Privileges.of(Privilege.DELETE));
        table.put(Operation.INSERT, Privileges.of(Privilege.INSERT));
        table.put(Operation.LOCK, Privileges.of(Privilege.LOCK));
        table.put(Operation.MKDIR, Privileges.of(Privilege.MKDIR));
        table.put(Operation.READ, Privileges.of(Privilege.READ));
        table.put(Operation.READDIR, Privileges.of(Privilege.READDIR));
        table.put(Operation.RENAME, Privileges.of(Privilege.RENAME));
        table.put(Operation.STAT, Privileges.of(Privilege.LOOKUP));
        table.put(Operation.UPDATE, Privileges.of(Privilege.UPDATE));
        TABLE = Collections.unmodifiableMap(table);
    }

    private PrivilegeMapper() {}

    /**
     * Privilege implied by an operation.
     *
     * @param operation the operation
     * @return the mapped privilege, {@link Privileges#NONE} for {@link Operation#ANY}
     */
    public static Privileges map(Operation operation) {
        return TABLE.get(operation);
    }

    /**
     * Add the privilege implied by {@code operation} to {@code privileges}.
     */
    public static Privileges accumulate(Operation operation, Privileges privileges) {
        return privileges.union(map(operation));
    }

    /**
     * Whether a computed privilege set covers a requested operation.
     *
     * <p>{@link Operation#ANY} is covered by any non-empty set.
     *
     * @param privileges the granted privileges
     * @param operation  the requested operation
     * @return true if the operation is permitted
     */
    public static boolean permits(Privileges privileges, Operation operation) {
        if (operation == Operation.ANY) {
            return !privileges.isNone();
        }
        return (privileges.mask() & map(operation).mask()) != 0;
    }
}
