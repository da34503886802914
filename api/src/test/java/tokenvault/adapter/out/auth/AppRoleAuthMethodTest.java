package tokenvault.adapter.out.auth;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import tokenvault.adapter.out.http.VaultHttpClient;

@DisplayName("AppRoleAuthMethod")
class AppRoleAuthMethodTest {

    private static final String LOGIN_URL = "/v1/auth/approle/login";

    @TempDir
    Path tempDir;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VaultHttpClient client;
    private Path roleIdFile;
    private Path secretIdFile;

    @BeforeEach
    void setUp() throws IOException {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        client = new VaultHttpClient(vertx, wireMockServer.baseUrl(), false, Duration.ofSeconds(5));

        roleIdFile = Files.writeString(tempDir.resolve("role_id"), "role-123\n");
        secretIdFile = Files.writeString(tempDir.resolve("secret_id"), "secret-456\n");
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    @Test
    @DisplayName("should require both credential files")
    void shouldRequireCredentialFiles() {
        assertThrows(IllegalArgumentException.class, () -> new AppRoleAuthMethod(null, secretIdFile));
        assertThrows(IllegalArgumentException.class, () -> new AppRoleAuthMethod(roleIdFile, null));
    }

    @Test
    @DisplayName("should log in with role_id and secret_id")
    void shouldLogInWithCredentials() {
        wireMockServer.stubFor(post(urlEqualTo(LOGIN_URL))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"auth\": {\"client_token\": \"s.approle\", \"lease_duration\": 3600}}")));

        var token = new AppRoleAuthMethod(roleIdFile, secretIdFile)
                .authenticate(client)
                .await()
                .indefinitely();

        assertEquals("s.approle", token);
        wireMockServer.verify(postRequestedFor(urlEqualTo(LOGIN_URL))
                .withRequestBody(equalToJson("{\"role_id\": \"role-123\", \"secret_id\": \"secret-456\"}")));
    }

    @Test
    @DisplayName("should fail when Vault returns no auth info")
    void shouldFailWithoutAuthInfo() {
        wireMockServer.stubFor(post(urlEqualTo(LOGIN_URL))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"data\": null, \"auth\": null}")));

        var method = new AppRoleAuthMethod(roleIdFile, secretIdFile);

        var error = assertThrows(
                VaultLoginException.class, () -> method.authenticate(client).await().indefinitely());

        assertEquals("No auth info returned from Vault", error.getMessage());
    }

    @Test
    @DisplayName("should fail without calling Vault when a credential file is missing")
    void shouldFailForMissingFile() {
        var method = new AppRoleAuthMethod(tempDir.resolve("missing"), secretIdFile);

        assertThrows(VaultLoginException.class, () -> method.authenticate(client).await().indefinitely());
        wireMockServer.verify(0, postRequestedFor(urlEqualTo(LOGIN_URL)));
    }
}
