package tokenacl.core.model.access;

import java.util.Locale;

/**
 * Kinds of access a storage request can ask for.
 *
 * <p>The set is closed: it mirrors the operations a storage server checks
 * before touching a path and does not grow at runtime.
 */
public enum Operation {
    ANY,
    CHMOD,
    CHOWN,
    CREATE,
    DELETE,
    INSERT,
    LOCK,
    MKDIR,
    READ,
    READDIR,
    RENAME,
    STAT,
    UPDATE;

    /**
     * Parse an operation from its name, ignoring case.
     *
     * @param value the operation name (e.g. "read", "Mkdir")
     * @return the matching operation
     * @throws IllegalArgumentException if the value names no operation
     */
    public static Operation fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operation cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operation: " + value, e);
        }
    }

    /**
     * Lower-case name used in scope strings and JSON.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
