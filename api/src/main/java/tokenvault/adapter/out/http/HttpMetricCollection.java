package tokenvault.adapter.out.http;

import java.util.List;
import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;

/**
 * Selects the meters updated by a single outbound HTTP request.
 *
 * <p>Passed explicitly to each {@link VaultHttpClient} call. Once the request completes,
 * the counter picker chooses the counters to increment and the timer picker chooses the
 * timers that record the request latency.
 *
 * <p>A status code of {@code 0} means no response was received.
 *
 * @param counterPicker picks the counters to increment
 * @param timerPicker   picks the timers to record the latency on
 */
public record HttpMetricCollection(CounterPicker counterPicker, TimerPicker timerPicker) {

    private static final Logger LOG = Logger.getLogger(HttpMetricCollection.class);

    /** Collection that records nothing. */
    public static final HttpMetricCollection NONE = new HttpMetricCollection(
            (method, statusCode, failure) -> List.of(), (method, statusCode, failure) -> List.of());

    /**
     * Picks counters for a completed request.
     */
    @FunctionalInterface
    public interface CounterPicker {
        List<Counter> pick(String method, int statusCode, Throwable failure);
    }

    /**
     * Picks timers for a completed request.
     */
    @FunctionalInterface
    public interface TimerPicker {
        List<Timer> pick(String method, int statusCode, Throwable failure);
    }

    /**
     * Record a completed request against the picked meters.
     *
     * <p>Never fails: a meter that cannot be picked or updated is logged and skipped, so
     * metrics never change the outcome of the request.
     *
     * @param method        the HTTP method
     * @param statusCode    the response status code, or 0 if there was no response
     * @param failure       the failure, or null
     * @param durationNanos request duration in nanoseconds
     */
    public void record(String method, int statusCode, Throwable failure, long durationNanos) {
        try {
            for (Counter counter : counterPicker.pick(method, statusCode, failure)) {
                counter.increment();
            }
            for (Timer timer : timerPicker.pick(method, statusCode, failure)) {
                timer.record(durationNanos, TimeUnit.NANOSECONDS);
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record metrics for %s request with status %d", method, statusCode);
        }
    }
}
