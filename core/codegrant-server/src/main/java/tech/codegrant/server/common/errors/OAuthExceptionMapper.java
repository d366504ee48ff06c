package tech.codegrant.server.common.errors;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * JAX-RS exception mapper for OAuthException.
 *
 * Response format:
 * <pre>
 * {
 *   "error": "invalid_grant",
 *   "error_description": "Invalid or expired authorization code"
 * }
 * </pre>
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

    @Override
    public Response toResponse(OAuthException exception) {
        Response.ResponseBuilder builder = Response.status(exception.getStatus())
            .type(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .entity(errorBody(exception.getError(), exception.getDescription()));

        if (exception.getError() == OAuthError.INVALID_TOKEN) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        } else if (exception.getStatus() == 401) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"codegrant\"");
        }
        return builder.build();
    }

    static Map<String, String> errorBody(OAuthError error, String description) {
        return Map.of("error", error.code(), "error_description", description);
    }
}
