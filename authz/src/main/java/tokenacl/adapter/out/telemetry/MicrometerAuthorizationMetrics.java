package tokenacl.adapter.out.telemetry;

import java.util.Locale;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import tokenacl.core.cache.RuleSetStore;
import tokenacl.core.config.TelemetryConfig;
import tokenacl.core.model.access.DecisionOutcome;
import tokenacl.core.port.out.AuthorizationMetrics;

/**
 * Records authorization metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tokenacl.decisions.total} - Decisions by deciding authority (rules, chain, none)</li>
 *   <li>{@code tokenacl.cache.lookups.total} - Token lookups by result (hit, miss)</li>
 *   <li>{@code tokenacl.validation.failures.total} - Tokens that produced no rules, by reason</li>
 *   <li>{@code tokenacl.cache.sweeps.total} - Completed expiry sweeps</li>
 *   <li>{@code tokenacl.cache.swept.total} - Entries removed by sweeps</li>
 *   <li>{@code tokenacl.cache.entries} - Cached rule sets gauge</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthorizationMetrics implements AuthorizationMetrics {

    private final MeterRegistry registry;
    private final RuleSetStore store;
    private final boolean enabled;

    @Inject
    public MicrometerAuthorizationMetrics(MeterRegistry registry, RuleSetStore store, TelemetryConfig config) {
        this.registry = registry;
        this.store = store;
        this.enabled = config != null && config.metricsEnabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("tokenacl.cache.entries", store, RuleSetStore::size)
                .description("Number of cached token rule sets")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(DecisionOutcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("tokenacl.decisions.total")
                .description("Authorization decisions by deciding authority")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheLookup(boolean hit) {
        if (!enabled) {
            return;
        }

        Counter.builder("tokenacl.cache.lookups.total")
                .description("Token rule set lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordValidationFailure(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("tokenacl.validation.failures.total")
                .description("Tokens that could not be turned into access rules")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    @Override
    public void recordSweep(int removed) {
        if (!enabled) {
            return;
        }

        Counter.builder("tokenacl.cache.sweeps.total")
                .description("Completed sweeps of expired rule sets")
                .register(registry)
                .increment();

        Counter.builder("tokenacl.cache.swept.total")
                .description("Expired rule sets removed by sweeps")
                .register(registry)
                .increment(removed);
    }
}
