package tokenvault.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenOwner")
class TokenOwnerTest {

    @Test
    @DisplayName("should reject null namespace")
    void shouldRejectNullNamespace() {
        assertThrows(IllegalArgumentException.class, () -> new TokenOwner(null, "name"));
    }

    @Test
    @DisplayName("should reject null name")
    void shouldRejectNullName() {
        assertThrows(IllegalArgumentException.class, () -> new TokenOwner("ns", null));
    }

    @Test
    @DisplayName("should compare by namespace and name")
    void shouldCompareByValue() {
        assertEquals(new TokenOwner("ns", "name"), new TokenOwner("ns", "name"));
        assertNotEquals(new TokenOwner("ns", "name"), new TokenOwner("other", "name"));
    }

    @Test
    @DisplayName("should render as namespace/name")
    void shouldRenderAsPath() {
        assertEquals("ns/name", new TokenOwner("ns", "name").toString());
    }
}
