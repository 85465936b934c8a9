package tokenacl.adapter.in.dto;

import java.util.List;

import tokenacl.core.model.config.AudienceConfig;

public record AudienceResponse(List<String> audiences) {

    public static AudienceResponse from(AudienceConfig config) {
        return new AudienceResponse(config.audiences());
    }
}
