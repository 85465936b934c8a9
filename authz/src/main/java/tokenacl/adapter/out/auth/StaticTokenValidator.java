package tokenacl.adapter.out.auth;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenacl.core.config.StaticTokenConfig;
import tokenacl.core.model.access.AccessRule;
import tokenacl.core.model.auth.TokenValidationResult;
import tokenacl.core.model.config.AudienceConfig;
import tokenacl.spi.TokenValidatorProvider;

/**
 * Validates tokens listed literally in configuration.
 *
 * <p>A token is recognised when it is one of the configured keys; anything
 * else is not applicable. An audience-bound token is rejected when the
 * deployment restricts audiences and does not accept the token's audience.
 * Entries with malformed scopes are skipped at startup.
 */
@ApplicationScoped
public class StaticTokenValidator implements TokenValidatorProvider {

    private static final Logger LOG = Logger.getLogger(StaticTokenValidator.class);

    private final boolean enabled;
    private final Map<String, StaticToken> tokens;

    @Inject
    public StaticTokenValidator(StaticTokenConfig config) {
        this(config.enabled(), loadTokens(config));
    }

    public StaticTokenValidator(boolean enabled, Map<String, StaticToken> tokens) {
        this.enabled = enabled;
        this.tokens = Map.copyOf(tokens);
        if (enabled) {
            LOG.warnf("Static token validator enabled with %d tokens; not for production use", this.tokens.size());
        }
    }

    private static Map<String, StaticToken> loadTokens(StaticTokenConfig config) {
        final var loaded = new HashMap<String, StaticToken>();
        config.tokens().forEach((token, entry) -> {
            final var rules = new ArrayList<AccessRule>();
            try {
                for (final var scope : entry.rules()) {
                    rules.add(AccessRule.parse(scope));
                }
            } catch (IllegalArgumentException e) {
                LOG.errorf("Skipping static token with invalid scope: %s", e.getMessage());
                return;
            }
            loaded.put(token, new StaticToken(
                    rules, entry.identity().orElse(""), entry.audience(), entry.lifetime().toSeconds()));
        });
        return loaded;
    }

    @Override
    public String name() {
        return "static";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return enabled && !tokens.isEmpty();
    }

    @Override
    public Uni<TokenValidationResult> validate(String token, AudienceConfig audiences) {
        final var entry = tokens.get(token);
        if (entry == null) {
            return Uni.createFrom().item(new TokenValidationResult.NotApplicable());
        }

        if (entry.audience().isPresent()
                && audiences.isRestricted()
                && !audiences.accepts(entry.audience().get())) {
            return Uni.createFrom()
                    .item(new TokenValidationResult.Invalid(
                            "Audience '%s' is not accepted".formatted(entry.audience().get())));
        }

        return Uni.createFrom()
                .item(new TokenValidationResult.Valid(entry.lifetimeSeconds(), entry.rules(), entry.identity()));
    }

    /**
     * A configured token.
     *
     * @param rules           rules granted by the token
     * @param identity        asserted identity, empty if none
     * @param audience        audience the token is bound to
     * @param lifetimeSeconds how long the rules may be cached
     */
    public record StaticToken(List<AccessRule> rules, String identity, Optional<String> audience, long lifetimeSeconds) {
        public StaticToken {
            rules = List.copyOf(rules);
            identity = identity == null ? "" : identity;
            audience = audience == null ? Optional.empty() : audience;
        }
    }
}
