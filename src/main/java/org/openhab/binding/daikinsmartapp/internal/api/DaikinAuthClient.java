package org.openhab.binding.daikinsmartapp.internal.api;

import static org.openhab.binding.daikinsmartapp.internal.DaikinSmartAppBindingConstants.RSC_OK;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.ClientCredentialResolver.ClientCredentials;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.model.Session;
import org.openhab.binding.daikinsmartapp.internal.util.EndpointResolver.Endpoints;
import org.openhab.binding.daikinsmartapp.internal.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Performs the password login of the mobile application. A login needs the
 * app client credentials, which are obtained through the
 * {@link ClientCredentialResolver} first.
 */
@NonNullByDefault
public class DaikinAuthClient {

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(DaikinAuthClient.class));

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(20);

    private final Endpoints ep;
    private final ClientCredentialResolver credentialResolver;
    private final HttpClient httpClient;
    private final String clientUuid;
    private final Duration sessionLifetime;
    private final Clock clock;

    public DaikinAuthClient(Endpoints ep, ClientCredentialResolver credentialResolver, HttpClient httpClient,
            String clientUuid, Duration sessionLifetime, Clock clock) {
        this.ep = Objects.requireNonNull(ep, "endpoints");
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.clientUuid = Objects.requireNonNull(clientUuid, "clientUuid");
        this.sessionLifetime = Objects.requireNonNull(sessionLifetime, "sessionLifetime");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Logs in with the given credential.
     *
     * @return a fresh session whose expiry is estimated from the configured
     *         lifetime
     * @throws AuthenticationFailedException if the server rejects the credential
     * @throws IOException on transport errors and server side failures
     */
    public Session login(Credential credential)
            throws AuthenticationFailedException, IOException, InterruptedException {
        ClientCredentials client = credentialResolver.resolve(credential, clientUuid);

        JsonObject body = new JsonObject();
        body.addProperty("client_secret", client.getClientSecret());
        body.addProperty("user_id", credential.getUsername());
        body.addProperty("uuid", clientUuid);
        body.addProperty("password", credential.getPassword());
        body.addProperty("client_id", client.getClientId());
        body.addProperty("grant_type", "password");

        URI loginUri = URI.create(ep.loginUrl());
        HttpRequest.Builder builder = HttpRequest.newBuilder(loginUri).timeout(REQUEST_TIMEOUT)
                .header("Accept", "*/*").header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        String userAgent = ep.userAgent;
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }

        logger.debug("Logging in as {} at {}", credential.getUsername(), LogSanitizer.uri(loginUri));
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        String responseBody = response.body() != null ? response.body() : "";
        JsonResponse json = new JsonResponse(response.statusCode(), responseBody, LogSanitizer.body(responseBody));
        logger.trace("Login response HTTP {}: {}", json.getStatusCode(), json.getBodyForLog());

        int status = json.getStatusCode();
        if (status == 400 || status == 401 || status == 403) {
            throw new AuthenticationFailedException(String.format("Login rejected (HTTP %d)", status));
        }
        if (status != 200) {
            throw logAndCreateException("Login failed", json);
        }
        JsonObject data = json.getBodyAsJson();
        if (data == null) {
            throw logAndCreateException("Login response is not a JSON object", json);
        }
        Integer rsc = optInt(data, "rsc");
        if (rsc == null || rsc.intValue() != RSC_OK) {
            throw new AuthenticationFailedException(
                    "Login rejected: rsc=" + rsc + " error=" + optString(data, "error"));
        }

        String accessToken = optString(data, "access_token");
        String idToken = optString(data, "id_token");
        if (isBlank(accessToken) && isBlank(idToken)) {
            throw new AuthenticationFailedException("Login succeeded but no token fields were returned");
        }
        Instant issuedAt = clock.instant();
        Session session = new Session(accessToken, idToken, optString(data, "refresh_token"), issuedAt,
                issuedAt.plus(sessionLifetime));
        logger.debug("Login for {} succeeded, session valid until {}", credential.getUsername(),
                session.getExpiresAt());
        return session;
    }

    private IOException logAndCreateException(String context, JsonResponse response) {
        String message = String.format("%s (HTTP %d)", context, response.getStatusCode());
        String sanitizedBody = response.getBodyForLog();
        logger.warn("{} - response body: {}", message, sanitizedBody);
        return new IOException(message + ": " + sanitizedBody);
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    private static @Nullable String optString(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    private static @Nullable Integer optInt(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        try {
            return Integer.valueOf(element.getAsInt());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
