package org.openhab.binding.daikinsmartapp.internal.api;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.util.EndpointResolver.Endpoints;
import org.openhab.binding.daikinsmartapp.internal.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Resolves the client id and secret of the mobile application. The vendor
 * hands them out from its common login endpoints, so they are requested once
 * with the account credentials and then kept for the lifetime of this
 * resolver.
 */
@NonNullByDefault
public class ClientCredentialResolver {

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(ClientCredentialResolver.class));

    private static final Pattern CLIENT_ID_PATTERN = Pattern.compile("client[_-]?id['\"\\s:=]+([A-Za-z0-9._-]{8,})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CLIENT_SECRET_PATTERN = Pattern
            .compile("client[_-]?secret['\"\\s:=]+([A-Za-z0-9._-]{16,})", Pattern.CASE_INSENSITIVE);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(20);

    private final List<URI> discoveryUris;
    private final HttpClient httpClient;
    private final @Nullable String userAgent;
    private @Nullable ClientCredentials cached;

    public ClientCredentialResolver(Endpoints ep, HttpClient httpClient) {
        this(ep, httpClient, null);
    }

    public ClientCredentialResolver(Endpoints ep, HttpClient httpClient, @Nullable ClientCredentials preset) {
        List<URI> uris = new ArrayList<>();
        for (String url : ep.credentialDiscoveryUrls) {
            uris.add(URI.create(url));
        }
        this.discoveryUris = List.copyOf(uris);
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.userAgent = ep.userAgent;
        this.cached = preset;
    }

    /**
     * Returns the app client credentials, requesting them from the discovery
     * endpoints on first use.
     *
     * @throws AuthenticationFailedException if every endpoint answered but none
     *             of the answers carried credentials
     * @throws IOException if no endpoint could be reached at all
     */
    public synchronized ClientCredentials resolve(Credential credential, String clientUuid)
            throws AuthenticationFailedException, IOException, InterruptedException {
        ClientCredentials localCached = cached;
        if (localCached != null) {
            return localCached;
        }

        IOException lastTransportError = null;
        boolean anyAnswer = false;
        for (URI uri : discoveryUris) {
            for (JsonObject payload : payloadVariants(credential, clientUuid)) {
                JsonResponse response;
                try {
                    response = post(uri, payload.toString());
                } catch (IOException e) {
                    logger.debug("Client credential discovery at {} failed: {}", LogSanitizer.uri(uri),
                            e.getMessage());
                    lastTransportError = e;
                    break;
                }
                anyAnswer = true;
                ClientCredentials resolved = null;
                JsonObject json = response.getBodyAsJson();
                if (json != null) {
                    resolved = extract(json);
                }
                if (resolved == null) {
                    resolved = extractFromText(response.getBody());
                }
                if (resolved != null) {
                    logger.debug("Resolved client credentials from {} (HTTP {})", LogSanitizer.uri(uri),
                            response.getStatusCode());
                    cached = resolved;
                    return resolved;
                }
            }
        }

        if (!anyAnswer && lastTransportError != null) {
            throw lastTransportError;
        }
        throw new AuthenticationFailedException("Could not resolve app client credentials from server");
    }

    public synchronized @Nullable ClientCredentials getCached() {
        return cached;
    }

    protected JsonResponse post(URI uri, String body) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json").header("Accept", "*/*")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        String localUserAgent = userAgent;
        if (localUserAgent != null && !localUserAgent.isBlank()) {
            builder.header("User-Agent", localUserAgent);
        }
        logger.trace("Sending client credential discovery request to {}", LogSanitizer.uri(uri));
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        String responseBody = response.body() != null ? response.body() : "";
        logger.trace("Client credential discovery response HTTP {}: {}", response.statusCode(),
                LogSanitizer.body(responseBody));
        return new JsonResponse(response.statusCode(), responseBody, LogSanitizer.body(responseBody));
    }

    private List<JsonObject> payloadVariants(Credential credential, String clientUuid) {
        List<JsonObject> variants = new ArrayList<>();
        variants.add(loginPayload("user_id", credential, clientUuid));
        variants.add(loginPayload("username", credential, clientUuid));
        variants.add(loginPayload("user_id", credential, null));
        variants.add(loginPayload("username", credential, null));
        return variants;
    }

    private JsonObject loginPayload(String userKey, Credential credential, @Nullable String clientUuid) {
        JsonObject payload = new JsonObject();
        payload.addProperty(userKey, credential.getUsername());
        payload.addProperty("password", credential.getPassword());
        if (clientUuid != null) {
            payload.addProperty("uuid", clientUuid);
        }
        return payload;
    }

    /**
     * Searches nested objects and arrays for an object holding both a client id
     * and a client secret.
     */
    static @Nullable ClientCredentials extract(JsonElement root) {
        Deque<JsonElement> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            JsonElement node = queue.pop();
            if (node.isJsonObject()) {
                String id = null;
                String secret = null;
                for (Map.Entry<String, JsonElement> entry : node.getAsJsonObject().entrySet()) {
                    String key = entry.getKey().toLowerCase(Locale.ROOT);
                    JsonElement value = entry.getValue();
                    if (("client_id".equals(key) || "clientid".equals(key)) && isString(value)) {
                        id = value.getAsString().trim();
                    } else if (("client_secret".equals(key) || "clientsecret".equals(key)) && isString(value)) {
                        secret = value.getAsString().trim();
                    } else if (value != null && (value.isJsonObject() || value.isJsonArray())) {
                        queue.add(value);
                    }
                }
                if (id != null && !id.isEmpty() && secret != null && !secret.isEmpty()) {
                    return new ClientCredentials(id, secret);
                }
            } else if (node.isJsonArray()) {
                for (JsonElement child : node.getAsJsonArray()) {
                    if (child != null) {
                        queue.add(child);
                    }
                }
            }
        }
        return null;
    }

    static @Nullable ClientCredentials extractFromText(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Matcher id = CLIENT_ID_PATTERN.matcher(text);
        Matcher secret = CLIENT_SECRET_PATTERN.matcher(text);
        if (!id.find() || !secret.find()) {
            return null;
        }
        return new ClientCredentials(Objects.requireNonNull(id.group(1)), Objects.requireNonNull(secret.group(1)));
    }

    private static boolean isString(@Nullable JsonElement value) {
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
    }

    /**
     * Client id and secret of the mobile application.
     */
    public static final class ClientCredentials {
        private final String clientId;
        private final String clientSecret;

        public ClientCredentials(String clientId, String clientSecret) {
            this.clientId = clientId;
            this.clientSecret = clientSecret;
        }

        public String getClientId() {
            return clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        @Override
        public String toString() {
            return "ClientCredentials[" + clientId + ", secret=" + LogSanitizer.REDACTED_VALUE + "]";
        }
    }
}
