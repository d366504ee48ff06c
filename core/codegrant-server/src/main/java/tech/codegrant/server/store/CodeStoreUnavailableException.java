package tech.codegrant.server.store;

/**
 * The code store backend could not complete an operation.
 */
public class CodeStoreUnavailableException extends RuntimeException {

    public CodeStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
