package tokenvault.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tokenvault.core.model.StorageHealth;
import tokenvault.core.port.out.StorageHealthIndicator;

@DisplayName("TokenStorageHealthCheck")
class TokenStorageHealthCheckTest {

    private StorageHealthIndicator indicator;
    private TokenStorageHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        indicator = mock(StorageHealthIndicator.class);
        healthCheck = new TokenStorageHealthCheck(indicator);
    }

    @Test
    @DisplayName("should return UP with role, status and latency when storage is available")
    void shouldReturnUp() {
        when(indicator.inspect()).thenReturn(Uni.createFrom().item(StorageHealth.available("vault", "standby", 429, 12)));

        HealthCheckResponse response = healthCheck.call().await().indefinitely();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("token-storage", response.getName());
        var data = response.getData().orElseThrow();
        assertEquals("vault", data.get("provider"));
        assertEquals("standby", data.get("detail"));
        assertEquals(429L, data.get("backendStatus"));
        assertEquals(12L, data.get("latencyMs"));
    }

    @Test
    @DisplayName("should return DOWN with the reason when storage is unavailable")
    void shouldReturnDown() {
        when(indicator.inspect())
                .thenReturn(Uni.createFrom().item(StorageHealth.unavailable("vault", "Vault is sealed", 503)));

        HealthCheckResponse response = healthCheck.call().await().indefinitely();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        var data = response.getData().orElseThrow();
        assertEquals("Vault is sealed", data.get("detail"));
        assertEquals(503L, data.get("backendStatus"));
        assertFalse(data.containsKey("latencyMs"));
    }

    @Test
    @DisplayName("should omit the backend status when the backend did not answer")
    void shouldOmitMissingBackendStatus() {
        when(indicator.inspect())
                .thenReturn(Uni.createFrom().item(StorageHealth.available("memory", "in-memory", 0, 0)));

        var data = healthCheck.call().await().indefinitely().getData().orElseThrow();

        assertFalse(data.containsKey("backendStatus"));
    }
}
