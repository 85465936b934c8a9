package tokenacl.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Loggable stand-in for a credential token.
 *
 * <p>Tokens are bearer credentials and must never reach a log file. The
 * fingerprint is a truncated SHA-256 digest: stable for a given token, so log
 * lines about the same token can be correlated, but not reversible.
 */
public final class TokenFingerprint {

    private static final int HEX_CHARS = 12;

    private TokenFingerprint() {}

    /**
     * Return the fingerprint of a token.
     *
     * @param token the raw token
     * @return {@code sha256:} followed by the first 12 hex characters of the digest
     */
    public static String of(String token) {
        if (token == null) {
            return "sha256:none";
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hashBytes = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return "sha256:" + HexFormat.of().formatHex(hashBytes).substring(0, HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is a required JDK algorithm", e);
        }
    }
}
