package tokenacl.core.model.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AccessEntity and AccessContext")
class AccessEntityTest {

    @Test
    @DisplayName("should assign a name only when absent")
    void shouldAssignNameWhenAbsent() {
        final var anonymous = AccessEntity.anonymous();
        final var named = AccessEntity.named("bob");

        assertTrue(anonymous.assignNameIfAbsent("alice"));
        assertFalse(anonymous.assignNameIfAbsent("carol"));
        assertFalse(named.assignNameIfAbsent("alice"));

        assertEquals(Optional.of("alice"), anonymous.name());
        assertEquals(Optional.of("bob"), named.name());
    }

    @Test
    @DisplayName("should ignore blank identities")
    void shouldIgnoreBlankIdentity() {
        final var entity = AccessEntity.anonymous();

        assertFalse(entity.assignNameIfAbsent(" "));
        assertTrue(entity.name().isEmpty());
    }

    @Test
    @DisplayName("should treat an empty token attribute as no token")
    void shouldTreatEmptyTokenAsAbsent() {
        assertTrue(AccessContext.withToken("").token().isEmpty());
        assertTrue(AccessContext.empty().token().isEmpty());
        assertEquals(Optional.of("abc"), AccessContext.withToken("abc").token());
    }

    @Test
    @DisplayName("should keep other attributes when replacing the token")
    void shouldKeepAttributes() {
        final var context = new AccessContext(Map.of("client", "xrootd")).withTokenAttribute("abc");

        assertEquals(Optional.of("xrootd"), context.attribute("client"));
        assertEquals(Optional.of("abc"), context.token());
        assertTrue(context.withTokenAttribute(null).token().isEmpty());
    }
}
