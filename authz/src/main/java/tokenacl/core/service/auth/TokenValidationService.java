package tokenacl.core.service.auth;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenacl.core.model.auth.TokenValidationResult;
import tokenacl.core.model.config.AudienceConfig;
import tokenacl.core.port.in.AudienceManagement;
import tokenacl.core.util.TokenFingerprint;
import tokenacl.spi.TokenValidatorProvider;

/**
 * Service that orchestrates token validation across installed validators.
 *
 * <p>Validators are tried by descending priority. The first one that
 * recognises the token decides; a token nobody recognises is
 * {@link TokenValidationResult.NotApplicable}. The active audiences are read
 * once per validation so a concurrent reconfiguration never mixes two lists.
 */
@ApplicationScoped
public class TokenValidationService {

    private static final Logger LOG = Logger.getLogger(TokenValidationService.class);

    private final List<TokenValidatorProvider> validators;
    private final AudienceManagement audiences;

    @Inject
    public TokenValidationService(Instance<TokenValidatorProvider> validatorInstances, AudienceManagement audiences) {
        this(validatorInstances.stream().toList(), audiences);
    }

    public TokenValidationService(List<TokenValidatorProvider> validators, AudienceManagement audiences) {
        this.validators = validators.stream()
                .sorted((a, b) -> Integer.compare(b.priority(), a.priority()))
                .filter(TokenValidatorProvider::isAvailable)
                .toList();
        this.audiences = audiences;

        if (this.validators.isEmpty()) {
            LOG.info("No token validators available; every token will fall through to the chained authorizer");
        } else {
            LOG.infov(
                    "TokenValidationService initialized with validators {0}",
                    this.validators.stream().map(TokenValidatorProvider::name).toList());
        }
    }

    /**
     * Validate a raw token against the installed validators.
     *
     * @param token the raw token
     * @return validation result; a failed Uni if a validator failed unexpectedly
     */
    public Uni<TokenValidationResult> validate(String token) {
        if (token == null || token.isEmpty() || validators.isEmpty()) {
            return Uni.createFrom().item(new TokenValidationResult.NotApplicable());
        }
        return validateWith(token, audiences.current(), 0);
    }

    /**
     * Names of the validators in the order they are tried.
     */
    public List<String> validatorNames() {
        return validators.stream().map(TokenValidatorProvider::name).toList();
    }

    private Uni<TokenValidationResult> validateWith(String token, AudienceConfig audienceConfig, int index) {
        if (index >= validators.size()) {
            return Uni.createFrom().item(new TokenValidationResult.NotApplicable());
        }

        final var validator = validators.get(index);
        return Uni.createFrom()
                .deferred(() -> validator.validate(token, audienceConfig))
                .onItem()
                .ifNull()
                .failWith(() -> new IllegalStateException("Validator " + validator.name() + " returned no result"))
                .flatMap(result -> {
                    if (result instanceof TokenValidationResult.NotApplicable) {
                        return validateWith(token, audienceConfig, index + 1);
                    }
                    LOG.debugv(
                            "Token {0} handled by validator {1}: {2}",
                            TokenFingerprint.of(token),
                            validator.name(),
                            result.getClass().getSimpleName());
                    return Uni.createFrom().item(result);
                });
    }
}
