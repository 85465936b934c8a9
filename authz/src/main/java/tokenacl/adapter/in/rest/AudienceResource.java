package tokenacl.adapter.in.rest;

import java.nio.file.Paths;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.jboss.logging.Logger;

import tokenacl.adapter.in.dto.AudienceResponse;
import tokenacl.adapter.in.problem.AccessProblem;
import tokenacl.adapter.out.config.FileConfigurationSource;
import tokenacl.adapter.out.config.InlineConfigurationSource;
import tokenacl.core.config.ReconfigurationConfig;
import tokenacl.core.port.in.AudienceManagement;

/**
 * REST resource for inspecting and reloading the accepted audiences.
 *
 * <p>A failed reload answers 422 and leaves the active list unchanged.
 * Content submitted with {@code PUT} replaces the active list until the next
 * reload or restart; it is not written back to the configuration file.
 */
@Path("/admin/audiences")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AudienceResource {

    private static final Logger LOG = Logger.getLogger(AudienceResource.class);

    private final AudienceManagement audiences;
    private final ReconfigurationConfig config;

    public AudienceResource(AudienceManagement audiences, ReconfigurationConfig config) {
        this.audiences = audiences;
        this.config = config;
    }

    @GET
    public AudienceResponse current() {
        return AudienceResponse.from(audiences.current());
    }

    @POST
    @Path("/reload")
    public AudienceResponse reload() {
        final var path = config.path()
                .orElseThrow(() -> AccessProblem.conflict("No configuration file set (tokenacl.config.path)"));

        LOG.infof("Reloading audience configuration from %s", path);
        return AudienceResponse.from(audiences.reconfigure(new FileConfigurationSource(Paths.get(path))));
    }

    @PUT
    @Consumes(MediaType.TEXT_PLAIN)
    public AudienceResponse replace(String content) {
        if (content == null || content.isBlank()) {
            throw AccessProblem.badRequest("Configuration content is required");
        }
        return AudienceResponse.from(audiences.reconfigure(new InlineConfigurationSource("request body", content)));
    }
}
