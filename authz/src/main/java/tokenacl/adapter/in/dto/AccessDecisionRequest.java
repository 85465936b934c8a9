package tokenacl.adapter.in.dto;

import java.util.Map;

/**
 * Request body for an access decision.
 *
 * @param path      requested path
 * @param operation operation name, e.g. {@code read}
 * @param token     credential token; optional when sent as a bearer header
 * @param entity    request subject; anonymous if absent
 * @param context   extra attributes passed to the chained authorizer
 */
public record AccessDecisionRequest(
        String path, String operation, String token, EntityDto entity, Map<String, String> context) {

    /**
     * Request subject as reported by the storage server.
     */
    public record EntityDto(String name, String host, String protocol) {}
}
