package tokenvault.adapter.out.auth;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenvault.adapter.out.http.VaultHttpClient;

/**
 * Logs the Vault client in and installs the issued client token.
 *
 * <p>Token renewal is not handled here.
 */
public class VaultLoginHandler {

    private static final Logger LOG = Logger.getLogger(VaultLoginHandler.class);

    private final VaultHttpClient client;
    private final VaultAuthMethod authMethod;

    public VaultLoginHandler(VaultHttpClient client, VaultAuthMethod authMethod) {
        this.client = client;
        this.authMethod = authMethod;
    }

    /**
     * Log in using the configured auth method.
     *
     * @return Uni completing once the client token is installed
     */
    public Uni<Void> login() {
        return authMethod
                .authenticate(client)
                .invoke(token -> {
                    client.setToken(token);
                    LOG.infof("Logged in to Vault at %s using %s authentication", client.address(), authMethod.name());
                })
                .onFailure()
                .transform(error -> error instanceof VaultLoginException
                        ? error
                        : new VaultLoginException(
                                "Vault " + authMethod.name() + " login failed: " + error.getMessage(), error))
                .replaceWithVoid();
    }
}
