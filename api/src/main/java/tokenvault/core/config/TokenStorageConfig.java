package tokenvault.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for token storage.
 *
 * <p>Configuration prefix: {@code tokenvault.storage}
 *
 * <p>Example configuration:
 * <pre>{@code
 * tokenvault.storage.provider=vault
 * tokenvault.storage.vault.host=https://vault.example.com:8200
 * tokenvault.storage.vault.auth-method=kubernetes
 * tokenvault.storage.vault.kubernetes.role=spi
 * tokenvault.storage.vault.data-path-prefix=spi
 * }</pre>
 */
@ConfigMapping(prefix = "tokenvault.storage")
public interface TokenStorageConfig {

    /**
     * Storage provider backing the token storage.
     *
     * @return Provider (default: vault)
     */
    @WithDefault("vault")
    Provider provider();

    /**
     * Vault configuration, used when the provider is {@code vault}.
     */
    VaultConfig vault();

    /**
     * Available storage providers.
     */
    enum Provider {
        /** HashiCorp Vault KV version 2 engine. */
        vault,
        /** Process-local map, for development and tests only. */
        memory
    }

    /**
     * Vault specific configuration.
     */
    interface VaultConfig {

        /**
         * Vault base URL, e.g. {@code https://vault.example.com:8200}.
         *
         * <p>Mandatory for the vault provider.
         *
         * @return Vault host URL
         */
        Optional<String> host();

        /**
         * Allow TLS connections to Vault with untrusted certificates.
         *
         * @return true to trust any certificate (default: false)
         */
        @WithName("insecure-tls")
        @WithDefault("false")
        boolean insecureTls();

        /**
         * Authentication method used to log in to Vault.
         *
         * @return Auth method (default: approle)
         */
        @WithName("auth-method")
        @WithDefault("approle")
        AuthMethod authMethod();

        /**
         * AppRole authentication settings.
         */
        AppRoleConfig approle();

        /**
         * Kubernetes authentication settings.
         */
        KubernetesConfig kubernetes();

        /**
         * Path prefix under which all token data is stored.
         *
         * <p>Leading and trailing {@code /} are trimmed.
         *
         * @return Data path prefix (default: spi)
         */
        @WithName("data-path-prefix")
        @WithDefault("spi")
        String dataPathPrefix();

        /**
         * Timeout applied to every request sent to Vault.
         *
         * @return Request timeout (default: 10 seconds)
         */
        @WithName("request-timeout")
        @WithDefault("PT10S")
        Duration requestTimeout();
    }

    /**
     * Vault authentication methods.
     */
    enum AuthMethod {
        approle,
        kubernetes
    }

    /**
     * AppRole authentication settings.
     */
    interface AppRoleConfig {

        /**
         * File containing the AppRole role_id.
         */
        @WithName("role-id-file-path")
        @WithDefault("/etc/spi/role_id")
        String roleIdFilePath();

        /**
         * File containing the AppRole secret_id.
         */
        @WithName("secret-id-file-path")
        @WithDefault("/etc/spi/secret_id")
        String secretIdFilePath();
    }

    /**
     * Kubernetes authentication settings.
     */
    interface KubernetesConfig {

        /**
         * Vault role bound to the service account. Mandatory for kubernetes authentication.
         */
        Optional<String> role();

        /**
         * File containing the service account token.
         *
         * <p>When empty, the token mounted into the pod by Kubernetes is used.
         * Mostly useful for local development.
         */
        @WithName("service-account-token-file-path")
        Optional<String> serviceAccountTokenFilePath();
    }
}
