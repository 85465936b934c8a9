package tokenacl.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Location of the INI file holding the audience settings.
 *
 * <p>Configuration prefix: {@code tokenacl.config}
 */
@ConfigMapping(prefix = "tokenacl.config")
public interface ReconfigurationConfig {

    /**
     * Path of the INI file read at startup and on reload.
     *
     * @return file path, empty to run without audience configuration
     */
    Optional<String> path();

    /**
     * Abort startup when the file cannot be loaded.
     *
     * <p>When false, the failure is logged and the service starts with an
     * empty audience list.
     *
     * @return true to fail startup (default: false)
     */
    @WithDefault("false")
    boolean failOnError();
}
