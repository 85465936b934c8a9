package tokenacl.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Statically configured tokens, for development and testing.
 *
 * <p>Configuration prefix: {@code tokenacl.validator.static}
 *
 * <pre>
 * tokenacl.validator.static.enabled=true
 * tokenacl.validator.static.tokens.dev-reader.rules=read:/data/,stat:/data/
 * tokenacl.validator.static.tokens.dev-reader.identity=alice
 * tokenacl.validator.static.tokens.dev-reader.lifetime=PT5M
 * </pre>
 *
 * <p>Never enable in production: the token string is the whole credential.
 */
@ConfigMapping(prefix = "tokenacl.validator.static")
public interface StaticTokenConfig {

    /**
     * Enable the static token validator.
     *
     * @return true if enabled (default: false)
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Configured tokens keyed by the literal token string.
     */
    Map<String, TokenEntry> tokens();

    interface TokenEntry {

        /**
         * Scope strings granted by the token.
         */
        List<String> rules();

        /**
         * Identity asserted by the token.
         *
         * @return identity, empty if not asserted
         */
        Optional<String> identity();

        /**
         * Audience the token was issued for.
         *
         * @return audience, empty if the token is not audience-bound
         */
        Optional<String> audience();

        /**
         * How long the derived rules may be cached.
         *
         * @return lifetime (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration lifetime();
    }
}
