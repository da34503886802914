package tokenvault.adapter.out.http;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A secret returned by the Vault HTTP API.
 *
 * <p>{@code data} and {@code auth} hold the generic JSON structures exactly as Vault returned
 * them: nested objects are {@link Map}s, arrays are {@link List}s.
 *
 * @param data     the {@code data} section, or null when absent
 * @param warnings warnings attached to the response (never null)
 * @param auth     the {@code auth} section, or null when absent
 */
public record VaultSecret(Map<String, Object> data, List<String> warnings, Map<String, Object> auth) {

    public VaultSecret {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Parse a Vault response body.
     *
     * @param json the response body
     * @return the secret
     */
    public static VaultSecret fromJson(JsonObject json) {
        return new VaultSecret(
                asMap(json.getValue("data")), asStrings(json.getValue("warnings")), asMap(json.getValue("auth")));
    }

    /**
     * Returns the client token of a login response.
     */
    public Optional<String> clientToken() {
        if (auth == null) {
            return Optional.empty();
        }
        return auth.get("client_token") instanceof String token && !token.isBlank()
                ? Optional.of(token)
                : Optional.empty();
    }

    /**
     * Checks whether the secret carries data or warnings.
     */
    public boolean hasContent() {
        return (data != null && !data.isEmpty()) || !warnings.isEmpty();
    }

    private static Map<String, Object> asMap(Object value) {
        if (value instanceof JsonObject object) {
            return object.getMap();
        }
        return null;
    }

    private static List<String> asStrings(Object value) {
        if (!(value instanceof JsonArray array)) {
            return List.of();
        }
        return array.stream().filter(w -> w != null).map(Object::toString).toList();
    }
}
