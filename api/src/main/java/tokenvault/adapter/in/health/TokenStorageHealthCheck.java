package tokenvault.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import tokenvault.core.port.out.StorageHealthIndicator;

/**
 * Readiness check for the token storage backend.
 */
@Readiness
@ApplicationScoped
public class TokenStorageHealthCheck implements AsyncHealthCheck {

    static final String NAME = "token-storage";

    private final StorageHealthIndicator indicator;

    @Inject
    public TokenStorageHealthCheck(StorageHealthIndicator indicator) {
        this.indicator = indicator;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return indicator.inspect().map(health -> {
            final var builder = HealthCheckResponse.named(NAME)
                    .withData("provider", health.provider())
                    .withData("detail", health.detail());
            if (health.backendStatus() > 0) {
                builder.withData("backendStatus", health.backendStatus());
            }
            if (health.available()) {
                return builder.withData("latencyMs", health.latencyMs()).up().build();
            }
            return builder.down().build();
        });
    }
}
