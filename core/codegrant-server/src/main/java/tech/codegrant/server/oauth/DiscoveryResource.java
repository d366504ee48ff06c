package tech.codegrant.server.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.codegrant.server.config.AuthServerConfig;
import tech.codegrant.server.token.TokenIssuer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authorization server metadata (RFC 8414).
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "OAuth2 discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class DiscoveryResource {

    @Inject
    AuthServerConfig authConfig;

    @Inject
    TokenIssuer tokenIssuer;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/oauth-authorization-server")
    @Operation(summary = "Get OAuth2 authorization server metadata")
    @APIResponse(responseCode = "200", description = "Authorization server metadata")
    public Map<String, Object> metadata() {
        String baseUrl = getBaseUrl();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("issuer", authConfig.issuer());
        metadata.put("authorization_endpoint", baseUrl + "/oauth2/authorize");
        metadata.put("token_endpoint", baseUrl + "/oauth2/token");
        metadata.put("userinfo_endpoint", baseUrl + "/oauth2/userinfo");
        metadata.put("response_types_supported", List.of("code"));
        metadata.put("grant_types_supported", tokenIssuer.refreshTokensEnabled()
            ? List.of(TokenRequest.GRANT_AUTHORIZATION_CODE, TokenRequest.GRANT_REFRESH_TOKEN)
            : List.of(TokenRequest.GRANT_AUTHORIZATION_CODE));
        metadata.put("code_challenge_methods_supported", List.of(PkceService.METHOD_S256));
        metadata.put("token_endpoint_auth_methods_supported",
            List.of("client_secret_basic", "client_secret_post", "none"));
        return metadata;
    }

    private String getBaseUrl() {
        return authConfig.externalBaseUrl()
            .orElseGet(() -> uriInfo.getBaseUri().toString())
            .replaceAll("/$", "");
    }
}
