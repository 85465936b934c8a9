package tokenacl.core.service.config;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import tokenacl.core.model.config.AudienceConfig;
import tokenacl.core.port.in.AudienceManagement;
import tokenacl.core.port.out.ConfigurationSource;

/**
 * Holds the active audience configuration and replaces it on reconfiguration.
 *
 * <p>A source is parsed completely before anything changes. Readers see
 * either the old list or the new one, never a partially loaded list. A
 * failed reconfiguration leaves the old list in effect.
 */
@ApplicationScoped
public class AudienceRegistry implements AudienceManagement {

    private static final Logger LOG = Logger.getLogger(AudienceRegistry.class);

    private final AtomicReference<AudienceConfig> active = new AtomicReference<>(AudienceConfig.empty());

    @Override
    public AudienceConfig reconfigure(ConfigurationSource source) {
        final AudienceConfig loaded;
        try {
            loaded = load(source);
        } catch (ConfigurationException e) {
            LOG.errorf("Reconfiguration failed, keeping %d previously configured audiences: %s",
                    active.get().audiences().size(), e.getMessage());
            throw e;
        }

        active.set(loaded);
        LOG.infof("Loaded %d audiences from %s", loaded.audiences().size(), source.name());
        return loaded;
    }

    @Override
    public AudienceConfig current() {
        return active.get();
    }

    /**
     * Parse a source without activating it.
     *
     * @param source the configuration to read
     * @return the audiences the source configures
     * @throws ConfigurationException if the source cannot be read or is invalid
     */
    public AudienceConfig load(ConfigurationSource source) {
        try (var reader = source.open()) {
            return AudienceConfigParser.parse(IniParser.parse(reader, source.name()), source.name());
        } catch (IOException e) {
            throw new ConfigurationException(
                    source.name(), "Error opening config file: " + e.getMessage(), e);
        }
    }
}
