package tokenacl.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tokenacl.core.port.in.AudienceManagement.ConfigurationException;

/**
 * Maps domain exceptions that reach the HTTP layer to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    /**
     * A rejected reconfiguration; the previously active audiences stay in effect.
     */
    @ServerExceptionMapper
    public Response mapConfigurationException(ConfigurationException e) {
        LOG.warnv("Rejected configuration from {0}: {1}", e.source(), e.getMessage());
        return toResponse(AccessProblem.configurationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
