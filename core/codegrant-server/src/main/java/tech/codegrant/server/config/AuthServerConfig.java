package tech.codegrant.server.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the authorization server.
 *
 * Example configuration:
 * <pre>
 * codegrant.auth.issuer=https://auth.example.com
 * codegrant.auth.authorization-code-expiry=PT10M
 * codegrant.auth.access-token-expiry=PT1H
 * codegrant.auth.refresh-tokens.enabled=true
 * codegrant.auth.refresh-tokens.expiry=P30D
 * </pre>
 */
@ConfigMapping(prefix = "codegrant.auth")
public interface AuthServerConfig {

    /**
     * Issuer identifier published in the discovery document.
     */
    @WithDefault("codegrant")
    String issuer();

    /**
     * Public base URL used to build endpoint URLs in the discovery document.
     * Falls back to the request base URI when absent.
     */
    @WithName("external-base-url")
    Optional<String> externalBaseUrl();

    /**
     * Authorization code lifetime.
     * Default: 10 minutes
     */
    @WithName("authorization-code-expiry")
    @WithDefault("PT10M")
    Duration authorizationCodeExpiry();

    /**
     * Access token lifetime, reported as expires_in.
     * Default: 1 hour
     */
    @WithName("access-token-expiry")
    @WithDefault("PT1H")
    Duration accessTokenExpiry();

    /**
     * Refresh token issuance and rotation.
     */
    @WithName("refresh-tokens")
    RefreshTokenConfig refreshTokens();

    /**
     * Parameters of the PKCE demo endpoint.
     */
    @WithName("pkce-demo")
    PkceDemoConfig pkceDemo();

    /**
     * Argon2id cost parameters for client secrets and user passwords.
     */
    Argon2Config argon2();

    interface RefreshTokenConfig {
        /**
         * Whether refresh tokens are issued and the refresh_token grant is accepted.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Refresh token lifetime.
         * Default: 30 days
         */
        @WithDefault("P30D")
        Duration expiry();
    }

    interface PkceDemoConfig {
        @WithName("client-id")
        @WithDefault("pkce-spa-client")
        String clientId();

        @WithName("redirect-uri")
        @WithDefault("http://localhost:3000/callback")
        String redirectUri();
    }

    interface Argon2Config {
        /**
         * Memory cost in KiB.
         * Default: 65536 (64 MiB)
         */
        @WithName("memory-cost")
        @WithDefault("65536")
        int memoryCost();

        @WithDefault("3")
        int iterations();

        @WithDefault("4")
        int parallelism();
    }
}
