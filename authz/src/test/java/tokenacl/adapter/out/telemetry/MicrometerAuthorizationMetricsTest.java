package tokenacl.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tokenacl.core.cache.LockingRuleSetStore;
import tokenacl.core.model.access.AccessRule;
import tokenacl.core.model.access.DecisionOutcome;
import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.RuleSet;

@DisplayName("MicrometerAuthorizationMetrics")
class MicrometerAuthorizationMetricsTest {

    private SimpleMeterRegistry registry;
    private LockingRuleSetStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new LockingRuleSetStore();
    }

    private MicrometerAuthorizationMetrics create(boolean enabled) {
        final var metrics = new MicrometerAuthorizationMetrics(registry, store, () -> enabled);
        metrics.init();
        return metrics;
    }

    @Test
    @DisplayName("should count decisions by outcome")
    void shouldCountDecisions() {
        final var metrics = create(true);

        metrics.recordDecision(DecisionOutcome.RULES);
        metrics.recordDecision(DecisionOutcome.RULES);
        metrics.recordDecision(DecisionOutcome.CHAIN);

        assertEquals(2.0, registry.get("tokenacl.decisions.total").tag("outcome", "rules").counter().count());
        assertEquals(1.0, registry.get("tokenacl.decisions.total").tag("outcome", "chain").counter().count());
    }

    @Test
    @DisplayName("should count lookups, failures and swept entries")
    void shouldCountCacheActivity() {
        final var metrics = create(true);

        metrics.recordCacheLookup(true);
        metrics.recordCacheLookup(false);
        metrics.recordValidationFailure("timeout");
        metrics.recordSweep(3);

        assertEquals(1.0, registry.get("tokenacl.cache.lookups.total").tag("result", "hit").counter().count());
        assertEquals(1.0, registry.get("tokenacl.cache.lookups.total").tag("result", "miss").counter().count());
        assertEquals(
                1.0,
                registry.get("tokenacl.validation.failures.total").tag("reason", "timeout").counter().count());
        assertEquals(3.0, registry.get("tokenacl.cache.swept.total").counter().count());
    }

    @Test
    @DisplayName("should report the number of cached rule sets")
    void shouldGaugeStoreSize() {
        create(true);
        store.put("token", new RuleSet(100, "", List.of(new AccessRule(Operation.READ, "/"))));

        assertEquals(1.0, registry.get("tokenacl.cache.entries").gauge().value());
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        final var metrics = create(false);

        metrics.recordDecision(DecisionOutcome.NONE);
        metrics.recordSweep(1);

        assertFalse(metrics.isEnabled());
        assertNull(registry.find("tokenacl.decisions.total").counter());
        assertTrue(registry.getMeters().isEmpty());
    }
}
