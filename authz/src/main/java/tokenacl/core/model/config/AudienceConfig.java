package tokenacl.core.model.config;

import java.util.List;

/**
 * Token audiences the validators should accept.
 *
 * <p>An empty list means no audience restriction is configured; what that
 * implies is up to each validator.
 *
 * @param audiences accepted audiences, in configuration order
 */
public record AudienceConfig(List<String> audiences) {

    private static final AudienceConfig EMPTY = new AudienceConfig(List.of());

    public AudienceConfig {
        audiences = audiences == null ? List.of() : List.copyOf(audiences);
    }

    public static AudienceConfig empty() {
        return EMPTY;
    }

    public boolean isRestricted() {
        return !audiences.isEmpty();
    }

    public boolean accepts(String audience) {
        return !isRestricted() || audiences.contains(audience);
    }
}
