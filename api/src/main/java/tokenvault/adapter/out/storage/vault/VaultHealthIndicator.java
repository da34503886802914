package tokenvault.adapter.out.storage.vault;

import io.smallrye.mutiny.Uni;

import tokenvault.adapter.out.http.VaultHttpClient;
import tokenvault.core.model.StorageHealth;
import tokenvault.core.port.out.StorageHealthIndicator;

/**
 * Reports Vault readiness from {@code sys/health}.
 *
 * <p>Active nodes (200), standby nodes (429) and performance standby nodes (473) can serve
 * requests. Uninitialized (501) and sealed (503) nodes cannot.
 */
public class VaultHealthIndicator implements StorageHealthIndicator {

    static final String PROVIDER = "vault";

    private final VaultHttpClient client;

    public VaultHealthIndicator(VaultHttpClient client) {
        this.client = client;
    }

    @Override
    public Uni<StorageHealth> inspect() {
        return Uni.createFrom().deferred(() -> {
            final var startTime = System.currentTimeMillis();
            return client.healthStatus()
                    .map(status -> toHealth(status, System.currentTimeMillis() - startTime))
                    .onFailure()
                    .recoverWithItem(error ->
                            StorageHealth.unavailable(PROVIDER, "Vault unreachable: " + error.getMessage(), 0));
        });
    }

    private StorageHealth toHealth(int status, long latencyMs) {
        return switch (status) {
            case 200 -> StorageHealth.available(PROVIDER, "active", status, latencyMs);
            case 429 -> StorageHealth.available(PROVIDER, "standby", status, latencyMs);
            case 473 -> StorageHealth.available(PROVIDER, "performance standby", status, latencyMs);
            case 501 -> StorageHealth.unavailable(PROVIDER, "Vault is not initialized", status);
            case 503 -> StorageHealth.unavailable(PROVIDER, "Vault is sealed", status);
            default -> StorageHealth.unavailable(PROVIDER, "Vault health returned status " + status, status);
        };
    }
}
