package tokenvault.core.model;

/**
 * Raised when a token storage operation fails.
 *
 * <p>Messages name the operation and the storage location but never include token values.
 */
public class TokenStorageException extends RuntimeException {

    public TokenStorageException(String message) {
        super(message);
    }

    public TokenStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
