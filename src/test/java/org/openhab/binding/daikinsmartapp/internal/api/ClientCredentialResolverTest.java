package org.openhab.binding.daikinsmartapp.internal.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.daikinsmartapp.internal.api.ClientCredentialResolver.ClientCredentials;
import org.openhab.binding.daikinsmartapp.internal.api.StubCloudServer.Reply;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.util.EndpointResolver.Endpoints;

import com.google.gson.JsonParser;

/**
 * Tests for {@link ClientCredentialResolver}.
 */
public @NonNullByDefault @SuppressWarnings("null") class ClientCredentialResolverTest {

    private static final Credential CREDENTIAL = new Credential("user@example.com", "secret");

    @Test
    void resolvesNestedCredentialsAndCachesThem() throws Exception {
        try (StubCloudServer server = new StubCloudServer()) {
            server.route(StubCloudServer.DISCOVERY_PATH, request -> Reply.ok(
                    "{\"result\":{\"app\":{\"client_id\":\"app-client-01\",\"client_secret\":\"0123456789abcdef0123\"}}}"));
            ClientCredentialResolver resolver = new ClientCredentialResolver(server.endpoints(),
                    HttpClient.newHttpClient());

            ClientCredentials first = resolver.resolve(CREDENTIAL, "uuid-1");
            ClientCredentials second = resolver.resolve(CREDENTIAL, "uuid-1");

            assertEquals("app-client-01", first.getClientId());
            assertEquals("0123456789abcdef0123", first.getClientSecret());
            assertSame(first, second);
            assertEquals(1, server.requests().size());
            String body = server.requests().get(0).body;
            assertTrue(body.contains("\"user_id\":\"user@example.com\""));
            assertTrue(body.contains("\"uuid\":\"uuid-1\""));
        }
    }

    @Test
    void triesEveryPayloadVariantBeforeGivingUp() throws Exception {
        try (StubCloudServer server = new StubCloudServer()) {
            server.route(StubCloudServer.DISCOVERY_PATH, request -> new Reply(400, "{\"error\":\"bad\"}"));
            ClientCredentialResolver resolver = new ClientCredentialResolver(server.endpoints(),
                    HttpClient.newHttpClient());

            assertThrows(AuthenticationFailedException.class, () -> resolver.resolve(CREDENTIAL, "uuid-1"));
            assertEquals(4, server.requests().size());
            assertTrue(server.requests().get(1).body.contains("\"username\""));
            assertFalse(server.requests().get(3).body.contains("uuid"));
            assertNull(resolver.getCached());
        }
    }

    @Test
    void presetCredentialsSkipDiscovery() throws Exception {
        Endpoints ep = new Endpoints();
        ep.credentialDiscoveryUrls.add("http://127.0.0.1:1/never");
        ClientCredentials preset = new ClientCredentials("preset-id", "preset-secret-value");
        ClientCredentialResolver resolver = new ClientCredentialResolver(ep, HttpClient.newHttpClient(), preset);

        assertSame(preset, resolver.resolve(CREDENTIAL, "uuid-1"));
    }

    @Test
    void unreachableEndpointsSurfaceTransportError() {
        Endpoints ep = new Endpoints();
        ep.credentialDiscoveryUrls.add("http://127.0.0.1:1/first");
        ep.credentialDiscoveryUrls.add("http://127.0.0.1:1/second");
        List<URI> attempted = new ArrayList<>();
        ClientCredentialResolver resolver = new ClientCredentialResolver(ep, HttpClient.newHttpClient()) {
            @Override
            protected JsonResponse post(URI uri, String body) throws IOException {
                attempted.add(uri);
                throw new IOException("connection refused");
            }
        };

        IOException error = assertThrows(IOException.class, () -> resolver.resolve(CREDENTIAL, "uuid-1"));
        assertEquals("connection refused", error.getMessage());
        assertEquals(2, attempted.size());
    }

    @Test
    void fallsBackToTextScanning() {
        ClientCredentials found = ClientCredentialResolver
                .extractFromText("var cfg = {clientId: 'abcdefgh123', clientSecret: 'ZYXWVUTSRQPONMLK9876'};");

        assertNotNull(found);
        assertEquals("abcdefgh123", found.getClientId());
        assertEquals("ZYXWVUTSRQPONMLK9876", found.getClientSecret());
        assertNull(ClientCredentialResolver.extractFromText("no credentials here"));
    }

    @Test
    void extractsFromArrays() {
        ClientCredentials found = ClientCredentialResolver.extract(JsonParser
                .parseString("{\"apps\":[{\"name\":\"x\"},{\"clientId\":\"id-in-array\",\"clientSecret\":\"s\"}]}"));

        assertNotNull(found);
        assertEquals("id-in-array", found.getClientId());
    }

    @Test
    void toStringRedactsSecret() {
        String text = new ClientCredentials("visible-id", "hidden-secret").toString();

        assertTrue(text.contains("visible-id"));
        assertFalse(text.contains("hidden-secret"));
    }
}
