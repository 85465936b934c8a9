package tokenacl.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the built-in chained authorizer.
 *
 * <p>Configuration prefix: {@code tokenacl.chain}
 *
 * <p>The chain answers whenever the token rules have no opinion. Its rules
 * apply to every request, with or without a token:
 * <pre>
 * tokenacl.chain.rules=read:/public/,stat:/public/
 * </pre>
 */
@ConfigMapping(prefix = "tokenacl.chain")
public interface ChainConfig {

    /**
     * Enable the built-in chained authorizer.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Scope strings ({@code operation:prefix}) granted to every request.
     *
     * @return rules, empty if none configured
     */
    Optional<List<String>> rules();
}
