package tech.codegrant.server.common.errors;

/**
 * Terminal protocol failure raised by the grant engine.
 *
 * Carries the OAuth error code, the HTTP status it maps to and a generic
 * description that is safe to return to the caller.
 */
public class OAuthException extends RuntimeException {

    private final OAuthError error;
    private final int status;

    public OAuthException(OAuthError error, int status, String description) {
        super(description);
        this.error = error;
        this.status = status;
    }

    public static OAuthException badRequest(OAuthError error, String description) {
        return new OAuthException(error, 400, description);
    }

    public static OAuthException unauthorized(OAuthError error, String description) {
        return new OAuthException(error, 401, description);
    }

    public OAuthError getError() {
        return error;
    }

    public int getStatus() {
        return status;
    }

    public String getDescription() {
        return getMessage();
    }
}
