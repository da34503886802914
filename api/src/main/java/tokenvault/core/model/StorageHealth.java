package tokenvault.core.model;

/**
 * Readiness of the token storage backend, as seen by a single inspection.
 *
 * @param provider      the storage provider, e.g. {@code vault}
 * @param available     whether tokens can be stored and read
 * @param detail        the backend role when available (e.g. {@code active}, {@code standby}),
 *                      otherwise the reason it is not
 * @param backendStatus the status code the backend answered the inspection with, 0 if it did not answer
 *                      or has no status codes
 * @param latencyMs     round trip of the inspection in milliseconds, -1 when unavailable
 */
public record StorageHealth(String provider, boolean available, String detail, int backendStatus, long latencyMs) {

    public static StorageHealth available(String provider, String role, int backendStatus, long latencyMs) {
        return new StorageHealth(provider, true, role, backendStatus, latencyMs);
    }

    public static StorageHealth unavailable(String provider, String reason, int backendStatus) {
        return new StorageHealth(provider, false, reason, backendStatus, -1);
    }
}
