package tokenvault.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Example configuration:
 * <pre>{@code
 * tokenvault.telemetry.metrics.enabled=false
 * }</pre>
 */
@ConfigMapping(prefix = "tokenvault.telemetry")
public interface TelemetryConfig {

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Register the Vault request metrics with the application meter registry.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
