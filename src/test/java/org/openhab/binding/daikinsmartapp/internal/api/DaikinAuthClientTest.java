package org.openhab.binding.daikinsmartapp.internal.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openhab.binding.daikinsmartapp.internal.DsiotFixtures;
import org.openhab.binding.daikinsmartapp.internal.MutableClock;
import org.openhab.binding.daikinsmartapp.internal.api.ClientCredentialResolver.ClientCredentials;
import org.openhab.binding.daikinsmartapp.internal.api.StubCloudServer.Reply;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.model.Session;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Tests for {@link DaikinAuthClient}.
 */
public @NonNullByDefault @SuppressWarnings("null") class DaikinAuthClientTest {

    private static final Credential CREDENTIAL = new Credential("user@example.com", "pw-123");

    private StubCloudServer server;
    private MutableClock clock;
    private DaikinAuthClient client;

    @BeforeEach
    public void setUp() throws IOException {
        server = new StubCloudServer();
        clock = new MutableClock(Instant.parse("2026-07-01T08:00:00Z"));
        HttpClient http = HttpClient.newHttpClient();
        ClientCredentialResolver resolver = new ClientCredentialResolver(server.endpoints(), http,
                new ClientCredentials("app-client", "app-secret-0123456789"));
        client = new DaikinAuthClient(server.endpoints(), resolver, http, "uuid-abc", Duration.ofMinutes(50),
                clock);
    }

    @AfterEach
    public void tearDown() {
        server.close();
    }

    @Test
    void loginReturnsSessionWithEstimatedExpiry() throws Exception {
        server.route(StubCloudServer.LOGIN_PATH, request -> Reply.ok(DsiotFixtures.loginResponse("ID", "ACCESS")));

        Session session = client.login(CREDENTIAL);

        assertEquals("ID", session.getIdToken());
        assertEquals("ACCESS", session.getAccessToken());
        assertEquals("REFRESH", session.getRefreshToken());
        assertEquals(Instant.parse("2026-07-01T08:00:00Z"), session.getIssuedAt());
        assertEquals(Instant.parse("2026-07-01T08:50:00Z"), session.getExpiresAt());
    }

    @Test
    void loginRequestCarriesPasswordGrant() throws Exception {
        server.route(StubCloudServer.LOGIN_PATH, request -> Reply.ok(DsiotFixtures.loginResponse("ID", "ACCESS")));

        client.login(CREDENTIAL);

        StubCloudServer.Recorded request = server.requestsTo(StubCloudServer.LOGIN_PATH).get(0);
        assertEquals("POST", request.method);
        JsonObject body = JsonParser.parseString(request.body).getAsJsonObject();
        assertEquals("password", body.get("grant_type").getAsString());
        assertEquals("user@example.com", body.get("user_id").getAsString());
        assertEquals("pw-123", body.get("password").getAsString());
        assertEquals("uuid-abc", body.get("uuid").getAsString());
        assertEquals("app-client", body.get("client_id").getAsString());
        assertEquals("app-secret-0123456789", body.get("client_secret").getAsString());
    }

    @Test
    void unauthorizedMeansBadCredentials() {
        server.route(StubCloudServer.LOGIN_PATH, request -> new Reply(401, "{\"error\":\"invalid_grant\"}"));

        assertThrows(AuthenticationFailedException.class, () -> client.login(CREDENTIAL));
    }

    @Test
    void rejectedResultCodeMeansBadCredentials() {
        server.route(StubCloudServer.LOGIN_PATH,
                request -> Reply.ok("{\"rsc\":4001,\"error\":\"wrong password\"}"));

        AuthenticationFailedException error = assertThrows(AuthenticationFailedException.class,
                () -> client.login(CREDENTIAL));
        assertTrue(error.getMessage().contains("4001"));
    }

    @Test
    void missingTokensAreRejected() {
        server.route(StubCloudServer.LOGIN_PATH, request -> Reply.ok("{\"rsc\":2000}"));

        assertThrows(AuthenticationFailedException.class, () -> client.login(CREDENTIAL));
    }

    @Test
    void serverErrorIsTransient() {
        server.route(StubCloudServer.LOGIN_PATH, request -> new Reply(503, "{\"error\":\"maintenance\"}"));

        IOException error = assertThrows(IOException.class, () -> client.login(CREDENTIAL));
        assertTrue(error.getMessage().contains("503"));
    }
}
