package tech.codegrant.server.store;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.codegrant.server.common.errors.OAuthError;

import java.util.Map;

/**
 * Maps a code store outage to 503 temporarily_unavailable.
 */
@Provider
public class CodeStoreUnavailableExceptionMapper implements ExceptionMapper<CodeStoreUnavailableException> {

    private static final Logger LOG = Logger.getLogger(CodeStoreUnavailableExceptionMapper.class);

    @Override
    public Response toResponse(CodeStoreUnavailableException exception) {
        LOG.warnf(exception, "Code store unavailable: %s", exception.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .type(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .entity(Map.of(
                "error", OAuthError.TEMPORARILY_UNAVAILABLE.code(),
                "error_description", "Authorization server is temporarily unavailable"
            ))
            .build();
    }
}
