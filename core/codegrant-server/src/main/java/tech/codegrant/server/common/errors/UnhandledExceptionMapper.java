package tech.codegrant.server.common.errors;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Last-resort mapper: logs the failure and returns a bare server_error body.
 * Stack traces and internal messages stay in the server log.
 */
@Provider
public class UnhandledExceptionMapper implements ExceptionMapper<Exception> {

    private static final Logger LOG = Logger.getLogger(UnhandledExceptionMapper.class);

    @Override
    public Response toResponse(Exception exception) {
        if (exception instanceof WebApplicationException webException) {
            return webException.getResponse();
        }

        LOG.error("Unhandled exception while processing request", exception);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
            .type(MediaType.APPLICATION_JSON)
            .entity(OAuthExceptionMapper.errorBody(OAuthError.SERVER_ERROR, "Internal server error"))
            .build();
    }
}
