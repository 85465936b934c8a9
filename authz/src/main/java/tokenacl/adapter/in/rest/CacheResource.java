package tokenacl.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import tokenacl.adapter.in.dto.CacheInvalidationResponse;
import tokenacl.core.port.in.CacheManagement;

/**
 * REST resource for dropping cached rule sets.
 */
@Path("/admin/cache")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CacheResource {

    private final CacheManagement cache;

    public CacheResource(CacheManagement cache) {
        this.cache = cache;
    }

    @DELETE
    public CacheInvalidationResponse invalidateAll() {
        return new CacheInvalidationResponse(cache.invalidateAll());
    }
}
