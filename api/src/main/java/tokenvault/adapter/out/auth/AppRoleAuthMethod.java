package tokenvault.adapter.out.auth;

import java.nio.file.Path;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import tokenvault.adapter.out.http.VaultHttpClient;

/**
 * Vault AppRole authentication.
 *
 * <p>The role id and secret id are read from files on every login, so rotated
 * credentials are picked up without a restart.
 */
public class AppRoleAuthMethod implements VaultAuthMethod {

    static final String MOUNT = "approle";

    private final Path roleIdFile;
    private final Path secretIdFile;

    public AppRoleAuthMethod(Path roleIdFile, Path secretIdFile) {
        if (roleIdFile == null || secretIdFile == null) {
            throw new IllegalArgumentException("AppRole authentication requires role_id and secret_id files");
        }
        this.roleIdFile = roleIdFile;
        this.secretIdFile = secretIdFile;
    }

    @Override
    public String name() {
        return MOUNT;
    }

    @Override
    public Uni<String> authenticate(VaultHttpClient client) {
        return Uni.createFrom()
                .item(() -> new JsonObject()
                        .put("role_id", VaultAuthMethod.readCredential(roleIdFile))
                        .put("secret_id", VaultAuthMethod.readCredential(secretIdFile)))
                .flatMap(body -> client.login(MOUNT, body))
                .map(response -> response.flatMap(secret -> secret.clientToken())
                        .orElseThrow(() -> new VaultLoginException("No auth info returned from Vault")));
    }
}
