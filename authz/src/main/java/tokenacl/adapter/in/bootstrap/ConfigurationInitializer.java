package tokenacl.adapter.in.bootstrap;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tokenacl.adapter.out.config.FileConfigurationSource;
import tokenacl.core.config.ReconfigurationConfig;
import tokenacl.core.port.in.AudienceManagement;
import tokenacl.core.port.in.AudienceManagement.ConfigurationException;

/**
 * Loads the audience configuration on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>No path configured: the service runs without audience restriction</li>
 *   <li>Unreadable or malformed file: logged, and startup continues with an
 *       empty list unless {@code tokenacl.config.fail-on-error=true}</li>
 * </ul>
 */
@ApplicationScoped
public class ConfigurationInitializer {

    private static final Logger LOG = Logger.getLogger(ConfigurationInitializer.class);

    private final AudienceManagement audiences;
    private final ReconfigurationConfig config;

    @Inject
    public ConfigurationInitializer(AudienceManagement audiences, ReconfigurationConfig config) {
        this.audiences = audiences;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (config.path().isEmpty()) {
            LOG.info("No configuration file set (tokenacl.config.path); audiences are unrestricted");
            return;
        }

        try {
            audiences.reconfigure(new FileConfigurationSource(Path.of(config.path().get())));
        } catch (ConfigurationException e) {
            if (config.failOnError()) {
                throw e;
            }
            LOG.warn("Continuing without audience configuration");
        }
    }
}
