package tokenacl.adapter.in.dto;

public record CacheInvalidationResponse(int removed) {}
