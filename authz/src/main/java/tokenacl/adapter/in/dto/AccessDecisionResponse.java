package tokenacl.adapter.in.dto;

import java.util.List;
import java.util.Locale;

import tokenacl.core.model.access.Operation;
import tokenacl.core.model.access.PrivilegeMapper;
import tokenacl.core.model.access.Privileges;

/**
 * Outcome of an access decision.
 *
 * @param privileges granted privilege names, lower case
 * @param mask       granted privileges as a bitmask
 * @param allowed    whether the requested operation is permitted
 * @param identity   the entity name after the decision, null if anonymous
 */
public record AccessDecisionResponse(List<String> privileges, int mask, boolean allowed, String identity) {

    public static AccessDecisionResponse from(Privileges privileges, Operation operation, String identity) {
        final var names = privileges.toSet().stream()
                .map(privilege -> privilege.name().toLowerCase(Locale.ROOT))
                .toList();
        return new AccessDecisionResponse(
                names, privileges.mask(), PrivilegeMapper.permits(privileges, operation), identity);
    }
}
