package tokenvault.adapter.out.http;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.core.http.HttpClientRequest;
import org.jboss.logging.Logger;

/**
 * Minimal client for the Vault HTTP API ({@code /v1/...}).
 *
 * <p>Response handling:
 * <ul>
 *   <li>2xx with a JSON body - the parsed {@link VaultSecret}</li>
 *   <li>204 or an empty body - no secret</li>
 *   <li>404 on read - the parsed body if it carries data or warnings, otherwise no secret</li>
 *   <li>any other 4xx/5xx - {@link VaultResponseException}</li>
 * </ul>
 *
 * <p>Every call takes the {@link HttpMetricCollection} that decides which meters the request
 * updates. The client token installed by {@link #setToken(String)} is sent with every request
 * except logins and health checks.
 *
 * <p>Cancelling the subscription of a call resets the in-flight request and reports a
 * {@link CancellationException} to the metric pickers. Requests that are still running are
 * bounded by the configured request timeout.
 */
public class VaultHttpClient {

    private static final Logger LOG = Logger.getLogger(VaultHttpClient.class);

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String REQUEST_HEADER = "X-Vault-Request";

    private final HttpClient httpClient;
    private final String address;
    private final long timeoutMillis;

    private volatile String token;

    public VaultHttpClient(Vertx vertx, String address, boolean insecureTls, Duration requestTimeout) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Vault address cannot be null or blank");
        }
        final var options = new HttpClientOptions();
        if (insecureTls) {
            LOG.warn("TLS certificate verification is disabled for Vault connections");
            options.setTrustAll(true).setVerifyHost(false);
        }
        this.httpClient = vertx.createHttpClient(options);
        this.address = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
        this.timeoutMillis = requestTimeout.toMillis();
    }

    /**
     * Install the client token used to authenticate subsequent requests.
     *
     * @param token the Vault client token
     */
    public void setToken(String token) {
        this.token = token;
    }

    /**
     * Returns the Vault base address, without trailing separator.
     */
    public String address() {
        return address;
    }

    /**
     * Read the secret at a path.
     *
     * @param path    path relative to {@code /v1/}
     * @param metrics meters updated by the request
     * @return the secret, or empty if Vault returned none
     */
    public Uni<Optional<VaultSecret>> read(String path, HttpMetricCollection metrics) {
        return send(HttpMethod.GET, path, null, metrics, true);
    }

    /**
     * Write a payload to a path.
     *
     * @param path    path relative to {@code /v1/}
     * @param body    the JSON payload
     * @param metrics meters updated by the request
     * @return the secret returned by the write, or empty if Vault returned none
     */
    public Uni<Optional<VaultSecret>> write(String path, JsonObject body, HttpMetricCollection metrics) {
        return send(HttpMethod.PUT, path, body, metrics, true);
    }

    /**
     * Delete the secret at a path.
     *
     * @param path    path relative to {@code /v1/}
     * @param metrics meters updated by the request
     * @return the secret returned by the delete, usually empty
     */
    public Uni<Optional<VaultSecret>> delete(String path, HttpMetricCollection metrics) {
        return send(HttpMethod.DELETE, path, null, metrics, true);
    }

    /**
     * Log in through an auth method mounted at {@code auth/<mount>}.
     *
     * <p>Login requests are sent without a client token and are not metered.
     *
     * @param mount the auth method mount, e.g. {@code approle}
     * @param body  the login payload
     * @return the login response
     */
    public Uni<Optional<VaultSecret>> login(String mount, JsonObject body) {
        return send(HttpMethod.POST, "auth/" + mount + "/login", body, HttpMetricCollection.NONE, false);
    }

    /**
     * Query {@code sys/health}.
     *
     * @return the HTTP status code returned by Vault
     */
    public Uni<Integer> healthStatus() {
        return httpClient
                .request(options(HttpMethod.GET, "sys/health", false, false))
                .chain(request -> request.send())
                .chain(response -> response.body().replaceWith(response.statusCode()));
    }

    private Uni<Optional<VaultSecret>> send(
            HttpMethod method, String path, JsonObject body, HttpMetricCollection metrics, boolean authenticated) {
        return Uni.createFrom().deferred(() -> {
            final var startTime = System.nanoTime();
            final var inFlight = new AtomicReference<HttpClientRequest>();

            return httpClient
                    .request(options(method, path, authenticated, body != null))
                    .invoke(inFlight::set)
                    .chain(request -> body == null ? request.send() : request.send(Buffer.buffer(body.encode())))
                    .chain(response -> response.body().map(buffer -> new RawResponse(response.statusCode(), buffer)))
                    .onItemOrFailure()
                    .transformToUni((resp, error) -> {
                        final var duration = System.nanoTime() - startTime;
                        metrics.record(method.name(), resp != null ? resp.statusCode() : 0, error, duration);
                        if (error != null) {
                            LOG.debugf(error, "Vault request failed: %s %s", method, path);
                            return Uni.createFrom().failure(error);
                        }
                        return Uni.createFrom().item(() -> toSecret(method, path, resp));
                    })
                    .onCancellation()
                    .invoke(() -> {
                        final var request = inFlight.get();
                        final var aborted = request != null && request.reset();
                        metrics.record(
                                method.name(),
                                0,
                                new CancellationException("Vault request cancelled: " + method + " " + path),
                                System.nanoTime() - startTime);
                        LOG.debugf("Vault request cancelled: %s %s, aborted: %s", method, path, aborted);
                    });
        });
    }

    private RequestOptions options(HttpMethod method, String path, boolean authenticated, boolean hasBody) {
        final var options = new RequestOptions()
                .setMethod(method)
                .setAbsoluteURI(address + "/v1/" + path)
                .setTimeout(timeoutMillis)
                .putHeader(REQUEST_HEADER, "true")
                .putHeader("Accept", "application/json");
        if (hasBody) {
            options.putHeader("Content-Type", "application/json");
        }
        final var currentToken = token;
        if (authenticated && currentToken != null) {
            options.putHeader(TOKEN_HEADER, currentToken);
        }
        return options;
    }

    private Optional<VaultSecret> toSecret(HttpMethod method, String path, RawResponse response) {
        final var status = response.statusCode();
        LOG.debugf("Vault responded %d to %s %s", status, method, path);

        if (status == 404 && method == HttpMethod.GET) {
            return parse(response).filter(VaultSecret::hasContent);
        }
        if (status >= 400) {
            throw new VaultResponseException(method.name(), path, status, errors(response));
        }
        if (status == 204) {
            return Optional.empty();
        }
        return parse(response);
    }

    private Optional<VaultSecret> parse(RawResponse response) {
        if (response.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(VaultSecret.fromJson(response.body().toJsonObject()));
    }

    private List<String> errors(RawResponse response) {
        if (response.isEmpty()) {
            return List.of();
        }
        try {
            final JsonArray errors = response.body().toJsonObject().getJsonArray("errors");
            if (errors == null) {
                return List.of();
            }
            return errors.stream().map(String::valueOf).toList();
        } catch (DecodeException | ClassCastException e) {
            // Not a Vault error document, e.g. a proxy error page
            return List.of(response.body().toString().strip());
        }
    }

    private record RawResponse(int statusCode, Buffer body) {

        boolean isEmpty() {
            return body == null || body.length() == 0;
        }
    }
}
