package tokenacl.core.model.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RuleSet")
class RuleSetTest {

    private static final List<AccessRule> RULES =
            List.of(new AccessRule(Operation.READ, "/data/"), new AccessRule(Operation.CREATE, "/data/public/"));

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("should union every matching rule")
        void shouldUnionMatchingRules() {
            final var ruleSet = new RuleSet(100, "", RULES);

            assertEquals(
                    Privileges.of(Privilege.READ, Privilege.CREATE),
                    ruleSet.apply(Operation.READ, "/data/public/file.txt"));
        }

        @Test
        @DisplayName("should return only the rules that match")
        void shouldApplyOuterRuleOnly() {
            final var ruleSet = new RuleSet(100, "", RULES);

            assertEquals(Privileges.of(Privilege.READ), ruleSet.apply(Operation.READ, "/data/private/file.txt"));
        }

        @Test
        @DisplayName("should return NONE when nothing matches")
        void shouldReturnNoneWithoutMatch() {
            final var ruleSet = new RuleSet(100, "", RULES);

            assertTrue(ruleSet.apply(Operation.READ, "/other/file.txt").isNone());
        }

        @Test
        @DisplayName("should not filter rules by the requested operation")
        void shouldNotFilterByOperation() {
            final var ruleSet = new RuleSet(100, "", RULES);

            assertEquals(
                    Privileges.of(Privilege.READ, Privilege.CREATE),
                    ruleSet.apply(Operation.DELETE, "/data/public/file.txt"));
        }

        @Test
        @DisplayName("should match ANY rules without adding privileges")
        void shouldIgnoreAnyRules() {
            final var ruleSet = new RuleSet(100, "", List.of(new AccessRule(Operation.ANY, "/")));

            assertTrue(ruleSet.apply(Operation.READ, "/data").isNone());
        }
    }

    @Nested
    @DisplayName("isExpired")
    class IsExpired {

        @Test
        @DisplayName("should be valid up to and including the expiry second")
        void shouldBeValidUntilExpiry() {
            final var ruleSet = new RuleSet(100, "", RULES);

            assertFalse(ruleSet.isExpired(99));
            assertFalse(ruleSet.isExpired(100));
            assertTrue(ruleSet.isExpired(101));
        }
    }

    @Test
    @DisplayName("should copy the rule list")
    void shouldCopyRules() {
        final var rules = new ArrayList<>(RULES);
        final var ruleSet = new RuleSet(100, null, rules);

        rules.clear();

        assertEquals(2, ruleSet.rules().size());
        assertEquals("", ruleSet.identity());
        assertThrows(UnsupportedOperationException.class, () -> ruleSet.rules().clear());
    }
}
