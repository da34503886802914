package tokenvault.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tokenvault.core.port.out.TokenStorage;

/**
 * Initializes the token storage on application startup.
 *
 * <p>Startup fails if the storage cannot be initialized, so the application never
 * serves with an unauthenticated storage.
 */
@ApplicationScoped
public class StorageInitializer {

    private static final Logger LOG = Logger.getLogger(StorageInitializer.class);

    private final TokenStorage tokenStorage;

    @Inject
    public StorageInitializer(TokenStorage tokenStorage) {
        this.tokenStorage = tokenStorage;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Initializing token storage...");
        try {
            tokenStorage.initialize().await().indefinitely();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to initialize token storage");
            throw e;
        }
        LOG.info("Token storage initialized successfully");
    }
}
