package tokenvault.adapter.out.storage;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import tokenvault.adapter.out.auth.AppRoleAuthMethod;
import tokenvault.adapter.out.auth.KubernetesAuthMethod;
import tokenvault.adapter.out.auth.VaultAuthMethod;
import tokenvault.adapter.out.auth.VaultLoginHandler;
import tokenvault.adapter.out.http.VaultHttpClient;
import tokenvault.adapter.out.storage.memory.InMemoryTokenStorage;
import tokenvault.adapter.out.storage.vault.VaultDataPaths;
import tokenvault.adapter.out.storage.vault.VaultHealthIndicator;
import tokenvault.adapter.out.storage.vault.VaultTokenStorage;
import tokenvault.adapter.out.telemetry.TelemetryConfig;
import tokenvault.adapter.out.telemetry.VaultMetrics;
import tokenvault.core.config.TokenStorageConfig;
import tokenvault.core.config.TokenStorageConfig.VaultConfig;
import tokenvault.core.model.StorageHealth;
import tokenvault.core.port.out.StorageHealthIndicator;
import tokenvault.core.port.out.TokenStorage;

/**
 * Produces the token storage selected by {@code tokenvault.storage.provider}.
 *
 * <p>Providers:
 * <ul>
 *   <li>{@code vault} - Vault KV version 2 storage, logging in with the configured auth method</li>
 *   <li>{@code memory} - process-local storage for development and tests</li>
 * </ul>
 */
@ApplicationScoped
public class TokenStorageProducer {

    private static final Logger LOG = Logger.getLogger(TokenStorageProducer.class);

    private final TokenStorageConfig config;
    private final TelemetryConfig telemetryConfig;
    private final Vertx vertx;
    private final Instance<MeterRegistry> meterRegistry;

    private VaultHttpClient vaultClient;

    @Inject
    public TokenStorageProducer(
            TokenStorageConfig config,
            TelemetryConfig telemetryConfig,
            Vertx vertx,
            Instance<MeterRegistry> meterRegistry) {
        this.config = config;
        this.telemetryConfig = telemetryConfig;
        this.vertx = vertx;
        this.meterRegistry = meterRegistry;
    }

    @Produces
    @ApplicationScoped
    public TokenStorage tokenStorage() {
        LOG.infof("Creating token storage from provider: %s", config.provider());
        return switch (config.provider()) {
            case memory -> new InMemoryTokenStorage();
            case vault -> createVaultStorage(config.vault());
        };
    }

    @Produces
    @ApplicationScoped
    public StorageHealthIndicator storageHealthIndicator() {
        return switch (config.provider()) {
            case memory -> () -> Uni.createFrom().item(StorageHealth.available("memory", "in-memory", 0, 0));
            case vault -> new VaultHealthIndicator(vaultClient());
        };
    }

    private VaultTokenStorage createVaultStorage(VaultConfig vaultConfig) {
        final var client = vaultClient();
        final VaultAuthMethod authMethod;
        try {
            authMethod = prepareAuth(vaultConfig);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("error preparing vault authentication: " + e.getMessage(), e);
        }

        return new VaultTokenStorage(
                client,
                new VaultLoginHandler(client, authMethod),
                new VaultMetrics(),
                metricsRegistry(),
                new VaultDataPaths(vaultConfig.dataPathPrefix()));
    }

    private synchronized VaultHttpClient vaultClient() {
        if (vaultClient == null) {
            final var vaultConfig = config.vault();
            final var host = vaultConfig
                    .host()
                    .filter(h -> !h.isBlank())
                    .orElseThrow(() -> new IllegalStateException(
                            "tokenvault.storage.vault.host must be set when using the vault provider"));
            vaultClient = new VaultHttpClient(vertx, host, vaultConfig.insecureTls(), vaultConfig.requestTimeout());
        }
        return vaultClient;
    }

    static VaultAuthMethod prepareAuth(VaultConfig vaultConfig) {
        return switch (vaultConfig.authMethod()) {
            case approle -> new AppRoleAuthMethod(
                    Path.of(vaultConfig.approle().roleIdFilePath()),
                    Path.of(vaultConfig.approle().secretIdFilePath()));
            case kubernetes -> new KubernetesAuthMethod(
                    vaultConfig.kubernetes().role().orElse(null),
                    vaultConfig
                            .kubernetes()
                            .serviceAccountTokenFilePath()
                            .filter(p -> !p.isBlank())
                            .map(Path::of)
                            .orElse(null));
        };
    }

    private MeterRegistry metricsRegistry() {
        if (!telemetryConfig.metrics().enabled() || !meterRegistry.isResolvable()) {
            return null;
        }
        return meterRegistry.get();
    }
}
