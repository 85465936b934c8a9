package tokenacl.core.model.access;

import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of granted privileges, stored as a bitmask.
 *
 * <p>An empty set ({@link #NONE}) means "no opinion", not "deny": callers fall
 * back to another authorizer when they receive it.
 *
 * @param mask the union of {@link Privilege#bit()} values
 */
public record Privileges(int mask) {

    private static final int ALL_BITS = allBits();

    public static final Privileges NONE = new Privileges(0);

    public Privileges {
        if ((mask & ~ALL_BITS) != 0) {
            throw new IllegalArgumentException("Unknown privilege bits in mask: 0x" + Integer.toHexString(mask));
        }
    }

    /**
     * Create a privilege set from individual privileges.
     */
    public static Privileges of(Privilege... privileges) {
        int mask = 0;
        for (Privilege privilege : privileges) {
            mask |= privilege.bit();
        }
        return new Privileges(mask);
    }

    /**
     * Union of this set and another.
     */
    public Privileges union(Privileges other) {
        if (other.mask == 0 || (mask | other.mask) == mask) {
            return this;
        }
        return new Privileges(mask | other.mask);
    }

    public boolean contains(Privilege privilege) {
        return (mask & privilege.bit()) != 0;
    }

    public boolean isNone() {
        return mask == 0;
    }

    /**
     * The privileges in this set, in declaration order.
     */
    public Set<Privilege> toSet() {
        final var result = EnumSet.noneOf(Privilege.class);
        for (Privilege privilege : Privilege.values()) {
            if (contains(privilege)) {
                result.add(privilege);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return isNone() ? "Privileges[NONE]" : "Privileges" + toSet();
    }

    private static int allBits() {
        int bits = 0;
        for (Privilege privilege : Privilege.values()) {
            bits |= privilege.bit();
        }
        return bits;
    }
}
