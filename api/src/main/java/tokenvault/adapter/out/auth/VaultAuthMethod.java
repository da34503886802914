package tokenvault.adapter.out.auth;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import io.smallrye.mutiny.Uni;

import tokenvault.adapter.out.http.VaultHttpClient;

/**
 * A way of obtaining a Vault client token.
 */
public interface VaultAuthMethod {

    /**
     * Name of the auth method, used for logging.
     */
    String name();

    /**
     * Log in to Vault.
     *
     * @param client the client to log in with
     * @return the client token issued by Vault
     */
    Uni<String> authenticate(VaultHttpClient client);

    /**
     * Read a credential file, stripping surrounding whitespace.
     *
     * @param file the file to read
     * @return the file content
     * @throws VaultLoginException if the file cannot be read or is empty
     */
    static String readCredential(Path file) {
        try {
            final var value = Files.readString(file).strip();
            if (value.isEmpty()) {
                throw new VaultLoginException("Credential file is empty: " + file);
            }
            return value;
        } catch (IOException e) {
            throw new VaultLoginException("Failed to read credential file: " + file, e);
        }
    }
}
