package tokenvault.core.port.out;

import io.smallrye.mutiny.Uni;

import tokenvault.core.model.StorageHealth;

/**
 * Reports whether the token storage backend can serve requests.
 */
@FunctionalInterface
public interface StorageHealthIndicator {

    /**
     * Inspect the backend.
     *
     * <p>The returned Uni does not fail: an unreachable backend is reported as
     * {@link StorageHealth#unavailable(String, String, int) unavailable}.
     */
    Uni<StorageHealth> inspect();
}
