package tokenvault.adapter.out.http;

import java.util.List;

/**
 * Raised when Vault answers a request with an error status.
 */
public class VaultResponseException extends RuntimeException {

    private final String method;
    private final String path;
    private final int statusCode;
    private final List<String> errors;

    public VaultResponseException(String method, String path, int statusCode, List<String> errors) {
        super("Vault returned status " + statusCode + " for " + method + " " + path
                + (errors.isEmpty() ? "" : ": " + String.join("; ", errors)));
        this.method = method;
        this.path = path;
        this.statusCode = statusCode;
        this.errors = List.copyOf(errors);
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /** Returns the error messages from the response body. */
    public List<String> getErrors() {
        return errors;
    }
}
