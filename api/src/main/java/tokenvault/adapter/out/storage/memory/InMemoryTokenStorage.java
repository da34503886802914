package tokenvault.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenvault.core.model.StoredToken;
import tokenvault.core.model.TokenOwner;
import tokenvault.core.port.out.TokenStorage;

/**
 * In-memory implementation of token storage.
 *
 * <p>This implementation is intended for development and testing only.
 * Tokens are lost on restart and not shared across instances.
 *
 * <p><strong>Warning:</strong> Do not use in production.
 */
public class InMemoryTokenStorage implements TokenStorage {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStorage.class);

    private final ConcurrentMap<TokenOwner, StoredToken> tokens = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> initialize() {
        return Uni.createFrom().voidItem().invoke(() -> LOG.info("Initialized in-memory token storage"));
    }

    @Override
    public Uni<Void> store(TokenOwner owner, StoredToken token) {
        return Uni.createFrom().item(() -> {
            tokens.put(owner, token);
            LOG.debugf("Stored token for owner: %s", owner);
            return null;
        });
    }

    @Override
    public Uni<Optional<StoredToken>> get(TokenOwner owner) {
        return Uni.createFrom().item(() -> {
            final var token = tokens.get(owner);
            if (token == null) {
                LOG.debugf("No token found for owner: %s", owner);
                return Optional.<StoredToken>empty();
            }
            return Optional.of(token);
        });
    }

    @Override
    public Uni<Void> delete(TokenOwner owner) {
        return Uni.createFrom().item(() -> {
            if (tokens.remove(owner) != null) {
                LOG.debugf("Deleted token for owner: %s", owner);
            }
            return null;
        });
    }

    /**
     * Get the current count of stored tokens (for testing).
     */
    public int getTokenCount() {
        return tokens.size();
    }
}
