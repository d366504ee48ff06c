package tech.codegrant.server.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.codegrant.server.common.errors.OAuthError;
import tech.codegrant.server.common.errors.OAuthException;
import tech.codegrant.server.config.AuthServerConfig;
import tech.codegrant.server.token.TokenResponse;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth2 endpoints for the authorization code flow with PKCE.
 *
 * The consent page itself is rendered elsewhere: /authorize returns the
 * consent context as JSON and the page posts the user's credentials to /approve.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth2")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);

    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    AuthServerConfig authConfig;

    @Inject
    AuthorizationRequestValidator requestValidator;

    @Inject
    ConsentService consentService;

    @Inject
    TokenExchangeHandler tokenExchangeHandler;

    @Inject
    RefreshTokenGrantHandler refreshTokenGrantHandler;

    @Inject
    UserInfoService userInfoService;

    @Inject
    PkceService pkceService;

    // ==================== Authorization Endpoint ====================

    /**
     * Validate an authorization request and return what the consent page shows.
     *
     * GET /oauth2/authorize?
     *   response_type=code
     *   &client_id=demo-client
     *   &redirect_uri=http://localhost:3000/callback
     *   &scope=read
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Path("/authorize")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Validate an authorization request")
    @APIResponse(responseCode = "200", description = "Consent context")
    @APIResponse(responseCode = "400", description = "Invalid authorization request")
    public ConsentContext authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "Registered redirect URI, matched exactly")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated)")
            @QueryParam("scope") String scope,

            @Parameter(description = "Client state, echoed back unchanged")
            @QueryParam("state") String state,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method (S256 only)")
            @QueryParam("code_challenge_method") String codeChallengeMethod
    ) {
        return requestValidator.validate(new AuthorizationRequest(
            clientId, redirectUri, responseType, scope, state, codeChallenge, codeChallengeMethod));
    }

    /**
     * Consent form submission. Redirects to the client with a code on success.
     */
    @POST
    @Path("/approve")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Approve an authorization request")
    @APIResponse(responseCode = "302", description = "Redirect to the client with code and state")
    @APIResponse(responseCode = "200", description = "Credentials rejected, consent context with error")
    @APIResponse(responseCode = "400", description = "Invalid authorization request")
    public Response approve(
            @FormParam("client_id") String clientId,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("scope") String scope,
            @FormParam("state") String state,
            @FormParam("code_challenge") String codeChallenge,
            @FormParam("code_challenge_method") String codeChallengeMethod,
            @FormParam("username") String username,
            @FormParam("password") String password
    ) {
        AuthorizationRequest request = new AuthorizationRequest(
            clientId, redirectUri, AuthorizationRequestValidator.RESPONSE_TYPE_CODE,
            scope, state, codeChallenge, codeChallengeMethod);

        ConsentOutcome outcome = consentService.approve(request, username, password);
        if (outcome instanceof ConsentOutcome.Redirect redirect) {
            return Response.status(Response.Status.FOUND)
                .location(redirect.location())
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .build();
        }

        ConsentOutcome.Rejected rejected = (ConsentOutcome.Rejected) outcome;
        return Response.ok(rejected.context(), MediaType.APPLICATION_JSON).build();
    }

    // ==================== Token Endpoint ====================

    /**
     * Token endpoint for authorization_code and refresh_token grants.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange code for tokens or refresh tokens")
    @APIResponse(responseCode = "200", description = "Tokens issued")
    @APIResponse(responseCode = "400", description = "invalid_grant, invalid_request, invalid_scope or unsupported_grant_type")
    @APIResponse(responseCode = "401", description = "Client authentication failed")
    @APIResponse(responseCode = "503", description = "Code store unavailable")
    public Response token(
            @HeaderParam("Authorization") String authHeader,

            @Parameter(description = "Grant type")
            @FormParam("grant_type") String grantType,

            @Parameter(description = "Authorization code (for authorization_code grant)")
            @FormParam("code") String code,

            @Parameter(description = "Redirect URI (must match authorization request)")
            @FormParam("redirect_uri") String redirectUri,

            @Parameter(description = "Client ID")
            @FormParam("client_id") String formClientId,

            @Parameter(description = "Client secret (confidential clients)")
            @FormParam("client_secret") String formClientSecret,

            @Parameter(description = "PKCE code verifier")
            @FormParam("code_verifier") String codeVerifier,

            @Parameter(description = "Refresh token (for refresh_token grant)")
            @FormParam("refresh_token") String refreshToken,

            @Parameter(description = "Requested scopes (refresh_token grant only)")
            @FormParam("scope") String scope
    ) {
        TokenResponse tokens;
        if (TokenRequest.GRANT_REFRESH_TOKEN.equals(grantType)) {
            tokens = refreshTokenGrantHandler.refresh(TokenRequest.refreshToken(
                refreshToken, scope, authHeader, formClientId, formClientSecret));
        } else {
            tokens = tokenExchangeHandler.exchange(new TokenRequest(
                grantType, code, redirectUri, codeVerifier, null, null,
                authHeader, formClientId, formClientSecret));
        }

        return Response.ok(tokens, MediaType.APPLICATION_JSON)
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .header("Pragma", "no-cache")
            .build();
    }

    // ==================== UserInfo Endpoint ====================

    @GET
    @Path("/userinfo")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get claims for the bearer token's user")
    @APIResponse(responseCode = "200", description = "User claims")
    @APIResponse(responseCode = "401", description = "Missing, unknown or expired token")
    public UserInfo userInfo(@HeaderParam("Authorization") String authHeader) {
        String accessToken = null;
        if (authHeader != null && authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            accessToken = authHeader.substring(BEARER_PREFIX.length()).trim();
        }

        return userInfoService.resolve(accessToken)
            .orElseThrow(() -> OAuthException.unauthorized(OAuthError.INVALID_TOKEN,
                "Access token is invalid or expired"));
    }

    // ==================== PKCE Demo ====================

    /**
     * Generate a verifier/challenge pair and show how a public client would use it.
     */
    @GET
    @Path("/pkce/demo")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Generate an example PKCE verifier and challenge")
    @APIResponse(responseCode = "200", description = "PKCE example")
    public PkceDemoResponse pkceDemo() {
        String verifier = pkceService.generateCodeVerifier();
        String challenge = pkceService.generateCodeChallenge(verifier);
        String clientId = authConfig.pkceDemo().clientId();
        String redirectUri = authConfig.pkceDemo().redirectUri();

        String authorizeUrl = "/oauth2/authorize"
            + "?response_type=code"
            + "&client_id=" + urlEncode(clientId)
            + "&redirect_uri=" + urlEncode(redirectUri)
            + "&scope=read"
            + "&state=demo-state"
            + "&code_challenge=" + challenge
            + "&code_challenge_method=" + PkceService.METHOD_S256;

        Map<String, String> tokenRequest = new LinkedHashMap<>();
        tokenRequest.put("grant_type", TokenRequest.GRANT_AUTHORIZATION_CODE);
        tokenRequest.put("code", "<authorization_code>");
        tokenRequest.put("redirect_uri", redirectUri);
        tokenRequest.put("client_id", clientId);
        tokenRequest.put("code_verifier", verifier);

        LOG.debugf("Generated PKCE demo pair for client %s", clientId);
        return new PkceDemoResponse(verifier, challenge, PkceService.METHOD_S256, authorizeUrl, tokenRequest);
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public record PkceDemoResponse(
        String code_verifier,
        String code_challenge,
        String code_challenge_method,
        String example_authorize_url,
        Map<String, String> example_token_request
    ) {
    }
}
