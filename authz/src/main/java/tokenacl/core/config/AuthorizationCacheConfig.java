package tokenacl.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the token rule cache.
 *
 * <p>Configuration prefix: {@code tokenacl.cache}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TOKENACL_CACHE_STORE} - {@code locking} or {@code caffeine}</li>
 *   <li>{@code TOKENACL_CACHE_SWEEP_INTERVAL} - e.g. "PT60S"</li>
 *   <li>{@code TOKENACL_CACHE_MAX_ENTRIES} - e.g. "100000"</li>
 *   <li>{@code TOKENACL_CACHE_VALIDATION_TIMEOUT} - e.g. "PT10S"</li>
 * </ul>
 */
@ConfigMapping(prefix = "tokenacl.cache")
public interface AuthorizationCacheConfig {

    /**
     * Store implementation backing the cache.
     *
     * @return store type (default: locking)
     */
    @WithDefault("locking")
    StoreType store();

    /**
     * Minimum time between two sweeps of expired entries.
     *
     * <p>Sweeps run inline on a request, never on a background thread.
     *
     * @return sweep interval (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration sweepInterval();

    /**
     * Upper bound on cached tokens. Only enforced by the {@code caffeine} store.
     *
     * @return maximum entries (default: 100000)
     */
    @WithDefault("100000")
    long maxEntries();

    /**
     * Longest a decision waits for token validation before falling back to the chain.
     *
     * @return validation timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration validationTimeout();

    enum StoreType {
        LOCKING,
        CAFFEINE
    }
}
