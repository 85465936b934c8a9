package tokenacl.adapter.out.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.jboss.logging.Logger;

import tokenacl.core.cache.CaffeineRuleSetStore;
import tokenacl.core.cache.LockingRuleSetStore;
import tokenacl.core.cache.RuleSetStore;
import tokenacl.core.config.AuthorizationCacheConfig;
import tokenacl.core.port.out.MonotonicClock;

/**
 * CDI producer selecting the rule set store configured by {@code tokenacl.cache.store}.
 */
@ApplicationScoped
public class RuleSetStoreProducer {

    private static final Logger LOG = Logger.getLogger(RuleSetStoreProducer.class);

    @Produces
    @ApplicationScoped
    RuleSetStore ruleSetStore(AuthorizationCacheConfig config, MonotonicClock clock) {
        return switch (config.store()) {
            case LOCKING -> {
                LOG.info("Using locking rule set store");
                yield new LockingRuleSetStore();
            }
            case CAFFEINE -> {
                LOG.infof("Using Caffeine rule set store (maxEntries: %d)", config.maxEntries());
                yield new CaffeineRuleSetStore(clock, config.maxEntries());
            }
        };
    }
}
