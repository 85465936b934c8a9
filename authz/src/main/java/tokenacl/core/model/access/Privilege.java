package tokenacl.core.model.access;

/**
 * A single grantable capability.
 *
 * <p>Each constant owns one fixed bit of a {@link Privileges} mask. The bit
 * values are part of the wire format of {@code /access/decide} and must not be
 * renumbered.
 */
public enum Privilege {
    DELETE(0x0001),
    INSERT(0x0002),
    LOCK(0x0004),
    LOOKUP(0x0008),
    RENAME(0x0010),
    READ(0x0020),
    UPDATE(0x0040),
    READDIR(0x0080),
    CHMOD(0x0100),
    CHOWN(0x0200),
    CREATE(0x0400),
    MKDIR(0x0800);

    private final int bit;

    Privilege(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }
}
