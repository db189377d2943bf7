package org.example.medassist.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Signing configuration for access tokens, bound from {@code app.jwt.*}.
 *
 * <pre>
 * app:
 *   jwt:
 *     secret: ${JWT_SECRET_KEY}
 *     algorithm: HS256
 *     access-token-expire-minutes: 30
 * </pre>
 *
 * @param secret HMAC signing secret, at least as long as the algorithm's key size.
 * @param algorithm JWS algorithm name, one of HS256, HS384, HS512.
 * @param accessTokenExpireMinutes Lifetime of issued tokens.
 */
@ConfigurationProperties(prefix = "app.jwt")
@Validated
public record JwtProperties(
        @NotBlank String secret, String algorithm, @Positive long accessTokenExpireMinutes) {

    public JwtProperties {
        if (algorithm == null || algorithm.isBlank()) {
            algorithm = "HS256";
        }
    }

    public Duration accessTokenTtl() {
        return Duration.ofMinutes(accessTokenExpireMinutes);
    }
}
