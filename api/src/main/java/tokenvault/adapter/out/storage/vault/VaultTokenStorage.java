package tokenvault.adapter.out.storage.vault;

import java.util.List;
import java.util.Optional;

import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenvault.adapter.out.auth.VaultLoginHandler;
import tokenvault.adapter.out.http.VaultHttpClient;
import tokenvault.adapter.out.http.VaultSecret;
import tokenvault.adapter.out.telemetry.VaultMetrics;
import tokenvault.core.model.StoredToken;
import tokenvault.core.model.TokenOwner;
import tokenvault.core.model.TokenStorageException;
import tokenvault.core.port.out.TokenStorage;

/**
 * Vault implementation of token storage on a KV version 2 secrets engine.
 *
 * <p>Tokens are stored at {@code <prefix>/data/<namespace>/<name>} as
 * {@code {"data": {username, access_token, token_type, refresh_token, expiry}}}.
 *
 * <p>Read outcomes:
 * <ul>
 *   <li>no secret, empty data, or {@code data.data == null} - no token</li>
 *   <li>data present without a {@code data} key - {@link CorruptedDataException}</li>
 *   <li>otherwise - the decoded token, see {@link VaultTokenCodec}</li>
 * </ul>
 *
 * <p>Warnings returned by Vault are logged and never fail an operation.
 */
public class VaultTokenStorage implements TokenStorage {

    private static final Logger LOG = Logger.getLogger(VaultTokenStorage.class);

    private final VaultHttpClient client;
    private final VaultLoginHandler loginHandler;
    private final VaultMetrics metrics;
    private final MeterRegistry meterRegistry;
    private final VaultDataPaths paths;

    /**
     * Create a Vault token storage.
     *
     * @param client        the Vault client
     * @param loginHandler  the login handler, or null to skip logging in
     * @param metrics       the Vault request metrics
     * @param meterRegistry the registry to register the metrics with, or null to disable metrics
     * @param paths         the data path builder
     */
    public VaultTokenStorage(
            VaultHttpClient client,
            VaultLoginHandler loginHandler,
            VaultMetrics metrics,
            MeterRegistry meterRegistry,
            VaultDataPaths paths) {
        this.client = client;
        this.loginHandler = loginHandler;
        this.metrics = metrics;
        this.meterRegistry = meterRegistry;
        this.paths = paths;
    }

    @Override
    public Uni<Void> initialize() {
        final Uni<Void> login;
        if (loginHandler != null) {
            login = loginHandler
                    .login()
                    .onFailure()
                    .transform(error -> new TokenStorageException("failed to login to Vault", error));
        } else {
            login = Uni.createFrom()
                    .voidItem()
                    .invoke(() -> LOG.info("no login handler configured for Vault - token refresh disabled"));
        }

        return login.invoke(this::registerMetrics);
    }

    private void registerMetrics() {
        if (meterRegistry == null) {
            LOG.info("no metrics registry configured - metrics collection for Vault access is disabled");
            return;
        }
        try {
            metrics.register(meterRegistry);
        } catch (RuntimeException e) {
            throw new TokenStorageException("failed to register Vault request metrics", e);
        }
    }

    @Override
    public Uni<Void> store(TokenOwner owner, StoredToken token) {
        final var path = paths.dataPath(owner);

        return client.write(path, VaultTokenCodec.toEnvelope(token), metrics.collection())
                .onFailure()
                .transform(error -> new TokenStorageException("error writing the data to Vault at '" + path + "'", error))
                .invoke(secret -> {
                    if (secret.isEmpty()) {
                        throw new UnspecifiedStoreException();
                    }
                    logWarnings(secret.get().warnings());
                    LOG.debugf("Stored token for owner: %s", owner);
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<StoredToken>> get(TokenOwner owner) {
        final var path = paths.dataPath(owner);

        return client.read(path, metrics.collection())
                .onFailure()
                .transform(error -> new TokenStorageException("error reading the data at '" + path + "'", error))
                .map(secret -> toToken(path, secret.orElse(null)));
    }

    private Optional<StoredToken> toToken(String path, VaultSecret secret) {
        if (secret == null || secret.data() == null || secret.data().isEmpty()) {
            LOG.debugf("no data found in vault at %s", path);
            return Optional.empty();
        }
        logWarnings(secret.warnings());

        if (!secret.data().containsKey("data")) {
            throw new CorruptedDataException(path);
        }
        final var data = secret.data().get("data");
        if (data == null) {
            // Soft-deleted versions keep their metadata but return null data
            LOG.debugf("no data found in vault at %s", path);
            return Optional.empty();
        }

        return Optional.of(VaultTokenCodec.decode(data));
    }

    @Override
    public Uni<Void> delete(TokenOwner owner) {
        final var path = paths.dataPath(owner);

        return client.delete(path, metrics.collection())
                .onFailure()
                .transform(error -> new TokenStorageException("error deleting the data at '" + path + "'", error))
                .invoke(secret -> LOG.debugf("deleted %s, secret: %s", path, secret.orElse(null)))
                .replaceWithVoid();
    }

    private void logWarnings(List<String> warnings) {
        for (String warning : warnings) {
            LOG.info(warning);
        }
    }

    /**
     * Vault accepted a write but returned nothing.
     */
    public static class UnspecifiedStoreException extends TokenStorageException {
        public UnspecifiedStoreException() {
            super("failed to store the token, no error but returned nil");
        }
    }

    /**
     * Vault returned data without the expected nested {@code data} document.
     */
    public static class CorruptedDataException extends TokenStorageException {
        private final String path;

        public CorruptedDataException(String path) {
            super("corrupted data in Vault at '" + path + "'");
            this.path = path;
        }

        /** Returns the path the corrupted data was read from. */
        public String getPath() {
            return path;
        }
    }
}
