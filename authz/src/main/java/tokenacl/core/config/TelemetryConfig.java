package tokenacl.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for authorization metrics.
 *
 * <p>Configuration prefix: {@code tokenacl.telemetry}
 */
@ConfigMapping(prefix = "tokenacl.telemetry")
public interface TelemetryConfig {

    /**
     * Record decision, cache and validation metrics.
     *
     * @return true if metrics are enabled (default: true)
     */
    @WithDefault("true")
    boolean metricsEnabled();
}
