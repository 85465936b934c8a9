package tokenacl.adapter.out.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tokenacl.core.model.access.AccessContext;
import tokenacl.core.model.access.AccessEntity;
import tokenacl.core.model.access.AccessRule;
import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.Privilege;
import tokenacl.core.model.access.Privileges;

@DisplayName("ConfiguredRuleAuthorizer")
class ConfiguredRuleAuthorizerTest {

    @Test
    @DisplayName("should grant configured rules on matching paths")
    void shouldGrantMatchingRules() {
        final var authorizer = new ConfiguredRuleAuthorizer(
                true,
                List.of(new AccessRule(Operation.READ, "/public/"), new AccessRule(Operation.STAT, "/public/")));

        final var result =
                authorizer.decide(AccessEntity.anonymous(), "/public/readme", Operation.READ, AccessContext.empty());

        assertEquals(Privileges.of(Privilege.READ, Privilege.LOOKUP), result);
    }

    @Test
    @DisplayName("should grant nothing outside the configured prefixes")
    void shouldGrantNothingElsewhere() {
        final var authorizer = new ConfiguredRuleAuthorizer(true, List.of(new AccessRule(Operation.READ, "/public/")));

        assertTrue(authorizer
                .decide(AccessEntity.anonymous(), "/private/x", Operation.READ, AccessContext.empty())
                .isNone());
    }

    @Test
    @DisplayName("should be unavailable when disabled or without rules")
    void shouldReportAvailability() {
        assertFalse(new ConfiguredRuleAuthorizer(false, List.of(new AccessRule(Operation.READ, "/"))).isAvailable());
        assertFalse(new ConfiguredRuleAuthorizer(true, List.of()).isAvailable());
    }
}
