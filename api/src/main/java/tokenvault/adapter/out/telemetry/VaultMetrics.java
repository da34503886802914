package tokenvault.adapter.out.telemetry;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicReference;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;

import tokenvault.adapter.out.http.HttpMetricCollection;

/**
 * Metrics for requests sent to Vault.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tokenvault.vault.request.count} - Request count by HTTP method and status code</li>
 *   <li>{@code tokenvault.vault.response.time} - Response time histogram by HTTP method and status code</li>
 * </ul>
 *
 * <p>Nothing is recorded until {@link #register(MeterRegistry)} has been called. Registration
 * claims both meter names in the registry: it fails if this instance is already registered, if
 * another instance registered against the same registry, or if the registry already holds meters
 * with either name. Meters are created per (method, status) pair on the first request that
 * produces it.
 */
public class VaultMetrics {

    private static final Logger LOG = Logger.getLogger(VaultMetrics.class);

    public static final String REQUEST_COUNT = "tokenvault.vault.request.count";
    public static final String RESPONSE_TIME = "tokenvault.vault.response.time";

    // Registries the Vault meter names are claimed in, by identity
    private static final Set<MeterRegistry> CLAIMED_REGISTRIES =
            Collections.synchronizedSet(Collections.newSetFromMap(new WeakHashMap<>()));

    private final AtomicReference<MeterRegistry> registry = new AtomicReference<>();
    private final HttpMetricCollection collection =
            new HttpMetricCollection(this::pickCounters, this::pickTimers);

    /**
     * Register the Vault metrics with a registry.
     *
     * @param meterRegistry the registry to record into
     * @throws IllegalStateException if this instance is already registered, or the registry already
     *                               holds Vault request metrics
     */
    public void register(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("Meter registry cannot be null");
        }
        if (registry.get() != null) {
            throw new IllegalStateException("Vault metrics are already registered");
        }
        for (String name : List.of(REQUEST_COUNT, RESPONSE_TIME)) {
            if (!meterRegistry.find(name).meters().isEmpty()) {
                throw new IllegalStateException("Meter registry already contains meters named " + name);
            }
        }
        if (!CLAIMED_REGISTRIES.add(meterRegistry)) {
            throw new IllegalStateException("Vault metrics are already registered with this meter registry");
        }
        if (!registry.compareAndSet(null, meterRegistry)) {
            CLAIMED_REGISTRIES.remove(meterRegistry);
            throw new IllegalStateException("Vault metrics are already registered");
        }

        LOG.info("Registered Vault request metrics");
    }

    /**
     * Checks whether the metrics are registered.
     */
    public boolean isRegistered() {
        return registry.get() != null;
    }

    /**
     * Returns the meter selection to pass along with each Vault request.
     */
    public HttpMetricCollection collection() {
        return collection;
    }

    List<Counter> pickCounters(String method, int statusCode, Throwable failure) {
        final var meterRegistry = registry.get();
        if (meterRegistry == null || statusCode == 0) {
            return List.of();
        }
        return List.of(requestCounter(meterRegistry, method, String.valueOf(statusCode)));
    }

    List<Timer> pickTimers(String method, int statusCode, Throwable failure) {
        final var meterRegistry = registry.get();
        if (meterRegistry == null || statusCode == 0) {
            return List.of();
        }
        return List.of(responseTimer(meterRegistry, method, String.valueOf(statusCode)));
    }

    private Counter requestCounter(MeterRegistry meterRegistry, String method, String status) {
        return Counter.builder(REQUEST_COUNT)
                .description("The request counts to Vault categorized by HTTP method status code")
                .tag("method", method)
                .tag("status", status)
                .register(meterRegistry);
    }

    private Timer responseTimer(MeterRegistry meterRegistry, String method, String status) {
        return Timer.builder(RESPONSE_TIME)
                .description("The response time of Vault requests categorized by HTTP method and status code")
                .tag("method", method)
                .tag("status", status)
                .publishPercentileHistogram()
                .register(meterRegistry);
    }
}
