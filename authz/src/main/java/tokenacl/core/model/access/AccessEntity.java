package tokenacl.core.model.access;

import java.util.Optional;

/**
 * The subject of a storage request, as seen by the host server.
 *
 * <p>The host owns this object. The authorization layer writes to it in one
 * place only: {@link #assignNameIfAbsent(String)}, which records the identity
 * a token asserted when the host had not identified the caller itself.
 * Instances are confined to the request that created them.
 */
public final class AccessEntity {

    private String name;
    private final String host;
    private final String protocol;

    public AccessEntity(String name, String host, String protocol) {
        this.name = blankToNull(name);
        this.host = host;
        this.protocol = protocol;
    }

    /**
     * An entity the host has not identified.
     */
    public static AccessEntity anonymous() {
        return new AccessEntity(null, null, null);
    }

    public static AccessEntity named(String name) {
        return new AccessEntity(name, null, null);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    public Optional<String> protocol() {
        return Optional.ofNullable(protocol);
    }

    /**
     * Set the name unless one is already present.
     *
     * @param identity the identity to record; blank values are ignored
     * @return true if the name was assigned by this call
     */
    public boolean assignNameIfAbsent(String identity) {
        if (name != null || identity == null || identity.isBlank()) {
            return false;
        }
        name = identity;
        return true;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public String toString() {
        return "AccessEntity{name=" + name + ", host=" + host + ", protocol=" + protocol + "}";
    }
}
