package tokenacl.core.service.access;

import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.TimeoutException;
import org.jboss.logging.Logger;

import tokenacl.core.cache.RuleSetStore;
import tokenacl.core.config.AuthorizationCacheConfig;
import tokenacl.core.model.access.AccessContext;
import tokenacl.core.model.access.AccessEntity;
import tokenacl.core.model.access.DecisionOutcome;
import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.Privileges;
import tokenacl.core.model.access.RuleSet;
import tokenacl.core.model.auth.TokenValidationResult;
import tokenacl.core.port.in.AccessDecisionUseCase;
import tokenacl.core.port.in.CacheManagement;
import tokenacl.core.port.out.AuthorizationMetrics;
import tokenacl.core.port.out.MonotonicClock;
import tokenacl.core.service.auth.TokenValidationService;
import tokenacl.core.util.TokenFingerprint;
import tokenacl.spi.ChainedAuthorizer;

/**
 * Token-keyed cache of compiled rule sets, and the decision protocol built on it.
 *
 * <p>A decision resolves the request's token to a {@link RuleSet}, reusing a
 * cached one while it is unexpired and asking the {@link TokenValidationService}
 * otherwise, then applies it to the requested path. The chained authorizer
 * answers instead whenever this layer has no opinion:
 * <ul>
 *   <li>the request carries no token</li>
 *   <li>no validator recognises the token, or the token is rejected</li>
 *   <li>validation fails or times out</li>
 *   <li>the token's rules grant nothing on the path</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>Validation and rule application run outside the store's guard. Two
 * requests presenting the same unseen token may both validate it and both
 * store the result; the last write wins.
 *
 * <h2>Expiry sweeps</h2>
 * <p>There is no background thread. At most once per sweep interval, the
 * first request to notice that a sweep is due removes every expired entry
 * before carrying on with its own decision.
 */
@ApplicationScoped
public class AuthorizationCache implements AccessDecisionUseCase, CacheManagement {

    private static final Logger LOG = Logger.getLogger(AuthorizationCache.class);

    private final RuleSetStore store;
    private final TokenValidationService validationService;
    private final Optional<ChainedAuthorizer> chain;
    private final MonotonicClock clock;
    private final AuthorizationMetrics metrics;
    private final long sweepIntervalSeconds;
    private final Duration validationTimeout;
    private final AtomicLong nextSweep;

    @Inject
    public AuthorizationCache(
            RuleSetStore store,
            TokenValidationService validationService,
            Instance<ChainedAuthorizer> chains,
            MonotonicClock clock,
            AuthorizationMetrics metrics,
            AuthorizationCacheConfig config) {
        this(
                store,
                validationService,
                selectChain(chains),
                clock,
                metrics,
                config.sweepInterval(),
                config.validationTimeout());
    }

    public AuthorizationCache(
            RuleSetStore store,
            TokenValidationService validationService,
            Optional<ChainedAuthorizer> chain,
            MonotonicClock clock,
            AuthorizationMetrics metrics,
            Duration sweepInterval,
            Duration validationTimeout) {
        if (sweepInterval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval cannot be negative: " + sweepInterval);
        }
        if (validationTimeout.isZero() || validationTimeout.isNegative()) {
            throw new IllegalArgumentException("Validation timeout must be positive: " + validationTimeout);
        }
        this.store = store;
        this.validationService = validationService;
        this.chain = chain;
        this.clock = clock;
        this.metrics = metrics;
        this.sweepIntervalSeconds = sweepInterval.toSeconds();
        this.validationTimeout = validationTimeout;
        this.nextSweep = new AtomicLong(clock.nowSeconds() + sweepIntervalSeconds);

        LOG.infof(
                "Authorization cache initialized (sweep interval: %ds, chain: %s)",
                sweepIntervalSeconds,
                chain.map(ChainedAuthorizer::name).orElse("none"));
    }

    private static Optional<ChainedAuthorizer> selectChain(Instance<ChainedAuthorizer> chains) {
        return chains.stream()
                .filter(ChainedAuthorizer::isAvailable)
                .max(Comparator.comparingInt(ChainedAuthorizer::priority));
    }

    /**
     * Decide the privileges of a request.
     *
     * <p>When the token's rule set asserts an identity and {@code entity} has no
     * name yet, the identity is assigned to {@code entity} before the rules are
     * applied, including when the final answer comes from the chain.
     */
    @Override
    public Privileges decide(AccessEntity entity, String path, Operation operation, AccessContext context) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(context, "context");

        final var token = context.token();
        if (token.isEmpty()) {
            return delegate(entity, path, operation, context);
        }

        final var now = clock.nowSeconds();
        sweepIfDue(now);

        final var ruleSet = resolve(token.get(), now);
        if (ruleSet.isEmpty()) {
            return delegate(entity, path, operation, context);
        }

        final var identity = ruleSet.get().identity();
        if (!identity.isEmpty() && entity.assignNameIfAbsent(identity)) {
            LOG.debugf("Assigned identity %s from token %s", identity, TokenFingerprint.of(token.get()));
        }

        final var privileges = ruleSet.get().apply(operation, path);
        if (privileges.isNone()) {
            return delegate(entity, path, operation, context);
        }

        metrics.recordDecision(DecisionOutcome.RULES);
        return privileges;
    }

    @Override
    public boolean invalidate(String token) {
        return store.invalidate(token);
    }

    @Override
    public int invalidateAll() {
        final var removed = store.invalidateAll();
        LOG.infof("Invalidated %d cached rule sets", removed);
        return removed;
    }

    @Override
    public int size() {
        return store.size();
    }

    /**
     * Whether a chained authorizer is configured.
     */
    public boolean hasChain() {
        return chain.isPresent();
    }

    private Privileges delegate(AccessEntity entity, String path, Operation operation, AccessContext context) {
        if (chain.isEmpty()) {
            metrics.recordDecision(DecisionOutcome.NONE);
            return Privileges.NONE;
        }
        metrics.recordDecision(DecisionOutcome.CHAIN);
        return chain.get().decide(entity, path, operation, context);
    }

    private Optional<RuleSet> resolve(String token, long now) {
        final var cached = store.find(token, now);
        metrics.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            return cached;
        }

        final var generated = generate(token, now);
        generated.ifPresent(ruleSet -> store.put(token, ruleSet));
        return generated;
    }

    private Optional<RuleSet> generate(String token, long now) {
        final TokenValidationResult result;
        try {
            result = validationService.validate(token).await().atMost(validationTimeout);
        } catch (TimeoutException e) {
            LOG.warnf("Validation of token %s timed out after %s", TokenFingerprint.of(token), validationTimeout);
            metrics.recordValidationFailure("timeout");
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Error generating access rules for token %s", TokenFingerprint.of(token));
            metrics.recordValidationFailure("error");
            return Optional.empty();
        }

        if (result instanceof TokenValidationResult.Valid valid) {
            final var expiry = expiryAfter(now, valid.lifetimeSeconds());
            LOG.debugf(
                    "Generated %d access rules for token %s (expiry: %d)",
                    (Object) valid.rules().size(), TokenFingerprint.of(token), expiry);
            return Optional.of(new RuleSet(expiry, valid.identity(), valid.rules()));
        }

        if (result instanceof TokenValidationResult.Invalid invalid) {
            LOG.debugf("Token %s rejected: %s", TokenFingerprint.of(token), invalid.reason());
            metrics.recordValidationFailure("invalid");
        } else {
            LOG.tracef("Token %s not recognised by any validator", TokenFingerprint.of(token));
        }
        return Optional.empty();
    }

    private void sweepIfDue(long now) {
        final var due = nextSweep.get();
        if (now <= due || !nextSweep.compareAndSet(due, now + sweepIntervalSeconds)) {
            return;
        }
        final var removed = store.sweepExpired(now);
        metrics.recordSweep(removed);
        if (removed > 0) {
            LOG.debugf("Swept %d expired rule sets (%d remaining)", removed, store.size());
        }
    }

    private static long expiryAfter(long now, long lifetimeSeconds) {
        return now > Long.MAX_VALUE - lifetimeSeconds ? Long.MAX_VALUE : now + lifetimeSeconds;
    }
}
