package tokenacl.core.port.in;

/**
 * Operator controls over the token rule cache.
 */
public interface CacheManagement {

    /**
     * Drop the cached rules of a single token.
     *
     * @param token the raw token
     * @return true if an entry was removed
     */
    boolean invalidate(String token);

    /**
     * Drop every cached rule set. Subsequent requests revalidate their tokens.
     *
     * @return number of entries removed
     */
    int invalidateAll();

    /**
     * Number of cached rule sets, expired ones included until swept.
     */
    int size();
}
