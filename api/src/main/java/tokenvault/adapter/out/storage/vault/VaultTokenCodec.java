package tokenvault.adapter.out.storage.vault;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import io.vertx.core.json.JsonObject;

import tokenvault.core.model.StoredToken;
import tokenvault.core.model.TokenStorageException;

/**
 * Converts {@link StoredToken}s to and from the documents stored in Vault.
 *
 * <p>Wire field names: {@code username}, {@code access_token}, {@code token_type},
 * {@code refresh_token}, {@code expiry}.
 *
 * <p>Decoding is deliberately asymmetric. A string field that is missing or not a string
 * decodes to an empty string. The {@code expiry} field decodes to 0 when missing but fails
 * with {@link InvalidDataException} when present and not an unsigned 64-bit integer.
 */
public final class VaultTokenCodec {

    static final String USERNAME = "username";
    static final String ACCESS_TOKEN = "access_token";
    static final String TOKEN_TYPE = "token_type";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String EXPIRY = "expiry";

    private VaultTokenCodec() {}

    /**
     * Wrap a token in the KV version 2 write envelope {@code {"data": {...}}}.
     *
     * @param token the token
     * @return the request payload
     */
    public static JsonObject toEnvelope(StoredToken token) {
        return new JsonObject().put("data", toJson(token));
    }

    static JsonObject toJson(StoredToken token) {
        return new JsonObject()
                .put(USERNAME, token.username())
                .put(ACCESS_TOKEN, token.accessToken())
                .put(TOKEN_TYPE, token.tokenType())
                .put(REFRESH_TOKEN, token.refreshToken())
                .put(EXPIRY, expiryValue(token.expiry()));
    }

    /**
     * Decode the nested {@code data} value of a KV version 2 read.
     *
     * @param data the value found under {@code data.data}
     * @return the token
     * @throws UnexpectedDataException if the value is not a string-keyed map
     * @throws InvalidDataException if the expiry cannot be read as an unsigned 64-bit integer
     */
    public static StoredToken decode(Object data) {
        final var fields = asMap(data);

        return new StoredToken(
                stringField(fields, USERNAME),
                stringField(fields, ACCESS_TOKEN),
                stringField(fields, TOKEN_TYPE),
                stringField(fields, REFRESH_TOKEN),
                unsignedLongField(fields, EXPIRY));
    }

    /**
     * Returns the field as a string, or an empty string if it is missing or not a string.
     */
    static String stringField(Map<String, Object> source, String fieldName) {
        return source.get(fieldName) instanceof String value ? value : "";
    }

    /**
     * Returns the field as an unsigned 64-bit value, or 0 if it is missing.
     *
     * @throws InvalidDataException if the field is present and cannot be parsed
     */
    static long unsignedLongField(Map<String, Object> source, String fieldName) {
        final var value = source.get(fieldName);
        if (value == null) {
            return 0L;
        }
        if (!(value instanceof Number) && !(value instanceof String)) {
            throw new InvalidDataException(fieldName, String.valueOf(value));
        }
        try {
            return Long.parseUnsignedLong(value.toString());
        } catch (NumberFormatException e) {
            throw new InvalidDataException(fieldName, value.toString());
        }
    }

    private static Map<String, Object> asMap(Object data) {
        if (data instanceof JsonObject json) {
            return json.getMap();
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new UnexpectedDataException();
        }
        final var result = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new UnexpectedDataException();
            }
            result.put(key, entry.getValue());
        }
        return result;
    }

    private static Object expiryValue(long expiry) {
        // Values above Long.MAX_VALUE are written as their unsigned magnitude
        return expiry >= 0 ? Long.valueOf(expiry) : new BigInteger(Long.toUnsignedString(expiry));
    }

    /**
     * The stored data is not a key-value document.
     */
    public static class UnexpectedDataException extends TokenStorageException {
        public UnexpectedDataException() {
            super("unexpected data");
        }
    }

    /**
     * A field of the stored data holds a value of the wrong form.
     */
    public static class InvalidDataException extends TokenStorageException {
        private final String fieldName;
        private final String rawValue;

        public InvalidDataException(String fieldName, String rawValue) {
            super("invalid data: invalid '" + fieldName + "' value. '" + rawValue
                    + "' can't be parsed to an unsigned 64-bit integer");
            this.fieldName = fieldName;
            this.rawValue = rawValue;
        }

        /** Returns the name of the offending field. */
        public String getFieldName() {
            return fieldName;
        }

        /** Returns the value that could not be parsed. */
        public String getRawValue() {
            return rawValue;
        }
    }
}
