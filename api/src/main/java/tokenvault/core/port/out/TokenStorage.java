package tokenvault.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tokenvault.core.model.StoredToken;
import tokenvault.core.model.TokenOwner;

/**
 * Persistent storage for OAuth tokens keyed by their owner.
 *
 * <p>Implementations keep no state between calls beyond what the backend holds. Every
 * operation is a single round trip and is not retried. Cancelling the subscription to
 * the returned {@link Uni} abandons the call.
 *
 * <p>Failures are reported as {@link tokenvault.core.model.TokenStorageException} or one of its
 * subclasses.
 */
public interface TokenStorage {

    /**
     * Prepare the storage for use.
     *
     * <p>Called once before any other operation. A failure means the storage must not be used.
     *
     * @return Uni completing when the storage is ready
     */
    Uni<Void> initialize();

    /**
     * Store the token of an owner, replacing any token stored before.
     *
     * @param owner the owner of the token
     * @param token the token to store
     * @return Uni completing when stored
     */
    Uni<Void> store(TokenOwner owner, StoredToken token);

    /**
     * Retrieve the token of an owner.
     *
     * @param owner the owner of the token
     * @return the token, or empty if none is stored
     */
    Uni<Optional<StoredToken>> get(TokenOwner owner);

    /**
     * Delete the token of an owner.
     *
     * @param owner the owner of the token
     * @return Uni completing when deleted
     */
    Uni<Void> delete(TokenOwner owner);
}
