package tokenacl.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;
import jakarta.ws.rs.core.Response.Status.Family;
import jakarta.ws.rs.core.Response.StatusType;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for access service errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem. Resource methods throw them directly.
 */
public final class AccessProblem {

    private static final StatusType UNPROCESSABLE_ENTITY = new StatusType() {
        @Override
        public int getStatusCode() {
            return 422;
        }

        @Override
        public Family getFamily() {
            return Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Unprocessable Entity";
        }
    };

    private AccessProblem() {}

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    /**
     * Configuration that could not be read or contains invalid values.
     */
    public static HttpProblem configurationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Configuration Error")
                .withStatus(UNPROCESSABLE_ENTITY)
                .withDetail(detail)
                .build();
    }
}
