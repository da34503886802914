package tokenvault.adapter.out.auth;

import java.nio.file.Path;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import tokenvault.adapter.out.http.VaultHttpClient;

/**
 * Vault Kubernetes authentication using a service account token.
 */
public class KubernetesAuthMethod implements VaultAuthMethod {

    static final String MOUNT = "kubernetes";
    static final Path DEFAULT_SERVICE_ACCOUNT_TOKEN =
            Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");

    private final String role;
    private final Path serviceAccountTokenFile;

    public KubernetesAuthMethod(String role, Path serviceAccountTokenFile) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Kubernetes authentication requires a Vault role");
        }
        this.role = role;
        this.serviceAccountTokenFile =
                serviceAccountTokenFile != null ? serviceAccountTokenFile : DEFAULT_SERVICE_ACCOUNT_TOKEN;
    }

    @Override
    public String name() {
        return MOUNT;
    }

    @Override
    public Uni<String> authenticate(VaultHttpClient client) {
        return Uni.createFrom()
                .item(() -> new JsonObject()
                        .put("role", role)
                        .put("jwt", VaultAuthMethod.readCredential(serviceAccountTokenFile)))
                .flatMap(body -> client.login(MOUNT, body))
                .map(response -> response.flatMap(secret -> secret.clientToken())
                        .orElseThrow(() -> new VaultLoginException("No auth info returned from Vault")));
    }

    Path serviceAccountTokenFile() {
        return serviceAccountTokenFile;
    }
}
