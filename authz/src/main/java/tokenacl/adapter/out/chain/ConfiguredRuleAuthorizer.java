package tokenacl.adapter.out.chain;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tokenacl.core.config.ChainConfig;
import tokenacl.core.model.access.AccessContext;
import tokenacl.core.model.access.AccessEntity;
import tokenacl.core.model.access.AccessRule;
import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.Privileges;
import tokenacl.core.model.access.RuleSet;
import tokenacl.spi.ChainedAuthorizer;

/**
 * Chained authorizer granting a fixed set of path-prefix rules to every request.
 *
 * <p>Rules come from {@code tokenacl.chain.rules} and match exactly the way
 * token rules do. Malformed scopes are logged and skipped.
 */
@ApplicationScoped
public class ConfiguredRuleAuthorizer implements ChainedAuthorizer {

    private static final Logger LOG = Logger.getLogger(ConfiguredRuleAuthorizer.class);

    private final boolean enabled;
    private final RuleSet rules;

    @Inject
    public ConfiguredRuleAuthorizer(ChainConfig config) {
        this(config.enabled(), parse(config.rules().orElse(List.of())));
    }

    public ConfiguredRuleAuthorizer(boolean enabled, List<AccessRule> rules) {
        this.enabled = enabled;
        this.rules = new RuleSet(Long.MAX_VALUE, "", rules);
    }

    private static List<AccessRule> parse(List<String> scopes) {
        final var parsed = new ArrayList<AccessRule>();
        for (final var scope : scopes) {
            try {
                parsed.add(AccessRule.parse(scope));
            } catch (IllegalArgumentException e) {
                LOG.errorf("Skipping invalid chain rule: %s", e.getMessage());
            }
        }
        return parsed;
    }

    @Override
    public String name() {
        return "configured-rules";
    }

    @Override
    public boolean isAvailable() {
        return enabled && !rules.rules().isEmpty();
    }

    @Override
    public Privileges decide(AccessEntity entity, String path, Operation operation, AccessContext context) {
        return rules.apply(operation, path);
    }
}
