package tokenvault.adapter.out.storage.vault;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tokenvault.adapter.out.storage.vault.VaultTokenCodec.InvalidDataException;
import tokenvault.adapter.out.storage.vault.VaultTokenCodec.UnexpectedDataException;
import tokenvault.core.model.StoredToken;

@DisplayName("VaultTokenCodec")
class VaultTokenCodecTest {

    private static Map<String, Object> fullData() {
        var data = new HashMap<String, Object>();
        data.put("username", "alice");
        data.put("access_token", "access-123");
        data.put("token_type", "bearer");
        data.put("refresh_token", "refresh-456");
        data.put("expiry", 1700000000L);
        return data;
    }

    @Nested
    @DisplayName("toEnvelope()")
    class ToEnvelopeTests {

        @Test
        @DisplayName("should wrap snake_case fields in a data envelope")
        void shouldWrapFieldsInDataEnvelope() {
            var envelope = VaultTokenCodec.toEnvelope(new StoredToken("alice", "access-123", "bearer", "refresh-456", 42));

            assertEquals(
                    new JsonObject(
                            """
                    {
                      "data": {
                        "username": "alice",
                        "access_token": "access-123",
                        "token_type": "bearer",
                        "refresh_token": "refresh-456",
                        "expiry": 42
                      }
                    }
                    """),
                    new JsonObject(envelope.encode()));
        }

        @Test
        @DisplayName("should write expiry above Long.MAX_VALUE as unsigned")
        void shouldWriteLargeExpiryUnsigned() {
            var envelope = VaultTokenCodec.toEnvelope(new StoredToken("u", "a", "t", "r", -1L));

            assertTrue(envelope.encode().contains("\"expiry\":18446744073709551615"));
        }
    }

    @Nested
    @DisplayName("decode()")
    class DecodeTests {

        @Test
        @DisplayName("should decode all fields")
        void shouldDecodeAllFields() {
            var token = VaultTokenCodec.decode(fullData());

            assertEquals(new StoredToken("alice", "access-123", "bearer", "refresh-456", 1700000000L), token);
        }

        @Test
        @DisplayName("should decode a JsonObject")
        void shouldDecodeJsonObject() {
            var token = VaultTokenCodec.decode(new JsonObject(fullData()));

            assertEquals("alice", token.username());
        }

        @Test
        @DisplayName("should default missing username to empty string")
        void shouldDefaultMissingUsername() {
            var data = fullData();
            data.remove("username");

            var token = VaultTokenCodec.decode(data);

            assertEquals("", token.username());
            assertEquals("access-123", token.accessToken());
        }

        @Test
        @DisplayName("should default non-string fields to empty string")
        void shouldDefaultNonStringFields() {
            var data = fullData();
            data.put("access_token", 12345);
            data.put("token_type", List.of("bearer"));
            data.put("refresh_token", null);

            var token = VaultTokenCodec.decode(data);

            assertEquals("", token.accessToken());
            assertEquals("", token.tokenType());
            assertEquals("", token.refreshToken());
        }

        @Test
        @DisplayName("should default missing expiry to zero")
        void shouldDefaultMissingExpiry() {
            var data = fullData();
            data.remove("expiry");

            assertEquals(0L, VaultTokenCodec.decode(data).expiry());
        }

        @Test
        @DisplayName("should decode expiry given as numeric string")
        void shouldDecodeNumericStringExpiry() {
            var data = fullData();
            data.put("expiry", "1700000000");

            assertEquals(1700000000L, VaultTokenCodec.decode(data).expiry());
        }

        @Test
        @DisplayName("should decode expiry above Long.MAX_VALUE")
        void shouldDecodeLargeExpiry() {
            var data = fullData();
            data.put("expiry", new BigInteger("18446744073709551615"));

            assertEquals(-1L, VaultTokenCodec.decode(data).expiry());
        }

        @Test
        @DisplayName("should fail with invalid data naming expiry for non-numeric text")
        void shouldFailOnNonNumericExpiry() {
            var data = fullData();
            data.put("expiry", "not-a-number");

            var error = assertThrows(InvalidDataException.class, () -> VaultTokenCodec.decode(data));

            assertEquals("expiry", error.getFieldName());
            assertEquals("not-a-number", error.getRawValue());
            assertTrue(error.getMessage().contains("expiry"));
            assertTrue(error.getMessage().contains("not-a-number"));
        }

        @Test
        @DisplayName("should fail with invalid data for negative expiry")
        void shouldFailOnNegativeExpiry() {
            var data = fullData();
            data.put("expiry", -5);

            assertThrows(InvalidDataException.class, () -> VaultTokenCodec.decode(data));
        }

        @Test
        @DisplayName("should fail with invalid data for fractional expiry")
        void shouldFailOnFractionalExpiry() {
            var data = fullData();
            data.put("expiry", 1.5d);

            assertThrows(InvalidDataException.class, () -> VaultTokenCodec.decode(data));
        }

        @Test
        @DisplayName("should fail with invalid data for boolean expiry")
        void shouldFailOnBooleanExpiry() {
            var data = fullData();
            data.put("expiry", true);

            assertThrows(InvalidDataException.class, () -> VaultTokenCodec.decode(data));
        }

        @Test
        @DisplayName("should fail with unexpected data when data is a string")
        void shouldFailWhenDataIsString() {
            var error = assertThrows(UnexpectedDataException.class, () -> VaultTokenCodec.decode("oops"));

            assertEquals("unexpected data", error.getMessage());
        }

        @Test
        @DisplayName("should fail with unexpected data when keys are not strings")
        void shouldFailWhenKeysAreNotStrings() {
            assertThrows(UnexpectedDataException.class, () -> VaultTokenCodec.decode(Map.of(1, "value")));
        }
    }
}
