package tokenvault.adapter.out.auth;

/**
 * Raised when logging in to Vault fails.
 */
public class VaultLoginException extends RuntimeException {

    public VaultLoginException(String message) {
        super(message);
    }

    public VaultLoginException(String message, Throwable cause) {
        super(message, cause);
    }
}
