package tokenacl.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tokenacl.core.model.access.AccessRule;
import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.RuleSet;
import tokenacl.mock.ManualClock;

@DisplayName("CaffeineRuleSetStore")
class CaffeineRuleSetStoreTest {

    private ManualClock clock;
    private CaffeineRuleSetStore store;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000);
        store = new CaffeineRuleSetStore(clock, 100);
    }

    private static RuleSet ruleSet(long expiry) {
        return new RuleSet(expiry, "", List.of(new AccessRule(Operation.READ, "/data/")));
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("should keep an entry through its expiry second")
        void shouldKeepUntilExpiry() {
            store.put("token", ruleSet(1_010));

            clock.advance(10);

            assertTrue(store.find("token", clock.nowSeconds()).isPresent());
        }

        @Test
        @DisplayName("should not return an entry after its expiry")
        void shouldExpire() {
            store.put("token", ruleSet(1_010));

            clock.advance(11);

            assertTrue(store.find("token", clock.nowSeconds()).isEmpty());
        }

        @Test
        @DisplayName("should never return an entry that is already expired when stored")
        void shouldRejectExpiredOnPut() {
            store.put("token", ruleSet(900));

            assertTrue(store.find("token", clock.nowSeconds()).isEmpty());
        }

        @Test
        @DisplayName("should sweep expired entries and keep live ones")
        void shouldSweepExpired() {
            store.put("short", ruleSet(1_005));
            store.put("long", ruleSet(2_000));

            clock.advance(60);
            store.sweepExpired(clock.nowSeconds());

            assertEquals(1, store.size());
            assertTrue(store.find("long", clock.nowSeconds()).isPresent());
        }

        @Test
        @DisplayName("should accept rule sets that never expire")
        void shouldAcceptUnboundedExpiry() {
            store.put("token", ruleSet(Long.MAX_VALUE));

            clock.advance(1_000_000);

            assertTrue(store.find("token", clock.nowSeconds()).isPresent());
        }
    }

    @Nested
    @DisplayName("Removal")
    class Removal {

        @Test
        @DisplayName("should invalidate a single token")
        void shouldInvalidateSingle() {
            store.put("a", ruleSet(2_000));
            store.put("b", ruleSet(2_000));

            assertTrue(store.invalidate("a"));
            assertFalse(store.invalidate("a"));
            assertTrue(store.find("b", clock.nowSeconds()).isPresent());
        }

        @Test
        @DisplayName("should invalidate all tokens")
        void shouldInvalidateAll() {
            store.put("a", ruleSet(2_000));
            store.put("b", ruleSet(2_000));

            assertEquals(2, store.invalidateAll());
            assertEquals(0, store.size());
        }
    }

    @Test
    @DisplayName("should reject a non-positive size bound")
    void shouldRejectInvalidBound() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineRuleSetStore(clock, 0));
    }
}
