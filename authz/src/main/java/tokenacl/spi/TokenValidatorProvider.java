package tokenacl.spi;

import io.smallrye.mutiny.Uni;

import tokenacl.core.model.auth.TokenValidationResult;
import tokenacl.core.model.config.AudienceConfig;

/**
 * Service Provider Interface for turning raw tokens into permission rules.
 *
 * <p>Implementations own everything about trust: signature checks, issuer
 * and audience validation, scope parsing. The authorization cache only sees
 * the outcome and caches {@link TokenValidationResult.Valid} results for their
 * lifetime.
 *
 * <h2>Provider Selection</h2>
 * <p>Providers are sorted by priority (highest first). The first provider that
 * returns something other than {@link TokenValidationResult.NotApplicable}
 * decides. If all providers pass, the token is not applicable and the request
 * falls through to the chained authorizer.
 *
 * <h2>Example Custom Provider</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class IssuerTokenValidator implements TokenValidatorProvider {
 *     @Override
 *     public String name() { return "issuer"; }
 *
 *     @Override
 *     public int priority() { return 100; }
 *
 *     @Override
 *     public Uni<TokenValidationResult> validate(String token, AudienceConfig audiences) {
 *         // Verify, then map scopes to AccessRule instances...
 *     }
 * }
 * }</pre>
 */
public interface TokenValidatorProvider {

    /**
     * Unique name identifying this validator.
     *
     * @return the validator name (e.g., "static", "issuer")
     */
    String name();

    /**
     * Priority for validator selection (higher = tried first).
     *
     * @return the validator priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this validator is available and properly configured.
     *
     * @return true if the validator can process tokens
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Validate a raw token.
     *
     * <p>Failures other than a rejected token (I/O errors, bugs) may be
     * signalled as a failed {@link Uni}; the caller treats them as a rejection.
     *
     * @param token     the raw token string
     * @param audiences audiences currently accepted by this deployment
     * @return Valid, NotApplicable or Invalid
     */
    Uni<TokenValidationResult> validate(String token, AudienceConfig audiences);
}
