package tokenacl.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;

import tokenacl.adapter.in.dto.AccessDecisionRequest;
import tokenacl.adapter.in.dto.AccessDecisionResponse;
import tokenacl.adapter.in.problem.AccessProblem;
import tokenacl.core.model.access.AccessContext;
import tokenacl.core.model.access.AccessEntity;
import tokenacl.core.model.access.Operation;
import tokenacl.core.port.in.AccessDecisionUseCase;

/**
 * REST resource answering access decisions for a storage server.
 *
 * <p>A token in the request body takes precedence over a bearer token in the
 * {@code Authorization} header.
 */
@Path("/access")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AccessResource {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessDecisionUseCase decisions;

    public AccessResource(AccessDecisionUseCase decisions) {
        this.decisions = decisions;
    }

    @POST
    @Path("/decide")
    @Consumes(MediaType.APPLICATION_JSON)
    public AccessDecisionResponse decide(
            AccessDecisionRequest request, @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        if (request == null) {
            throw AccessProblem.badRequest("Request body is required");
        }
        if (request.path() == null || request.path().isEmpty()) {
            throw AccessProblem.badRequest("path is required");
        }
        if (request.operation() == null) {
            throw AccessProblem.badRequest("operation is required");
        }

        final Operation operation;
        try {
            operation = Operation.fromName(request.operation());
        } catch (IllegalArgumentException e) {
            throw AccessProblem.badRequest(e.getMessage());
        }

        final var entity = request.entity() == null
                ? AccessEntity.anonymous()
                : new AccessEntity(
                        request.entity().name(), request.entity().host(), request.entity().protocol());

        var context = new AccessContext(request.context());
        final var token = request.token() != null ? request.token() : bearerToken(authorization);
        if (token != null) {
            context = context.withTokenAttribute(token);
        }

        final var privileges = decisions.decide(entity, request.path(), operation, context);
        return AccessDecisionResponse.from(privileges, operation, entity.name().orElse(null));
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
