package org.openhab.binding.daikinsmartapp.internal.api;

import static org.openhab.binding.daikinsmartapp.internal.DaikinSmartAppBindingConstants.*;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.CommandSubmissionFailedException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.DaikinException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.DeviceUnreachableException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.DiscoveryFailedException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.UnknownDeviceException;
import org.openhab.binding.daikinsmartapp.internal.api.mapper.DsiotStatusMapper;
import org.openhab.binding.daikinsmartapp.internal.model.Capability;
import org.openhab.binding.daikinsmartapp.internal.model.Command;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceStatusSnapshot;
import org.openhab.binding.daikinsmartapp.internal.model.OperationMode;
import org.openhab.binding.daikinsmartapp.internal.model.Session;
import org.openhab.binding.daikinsmartapp.internal.util.EndpointResolver.Endpoints;
import org.openhab.binding.daikinsmartapp.internal.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Typed access to the Daikin dsiot cloud. Every call is a multi-request sent
 * with a bearer token from the {@link SessionManager}. An unauthorized answer
 * is retried with the other token kind, then once more after a re-login; a
 * further rejection fails the call with {@link AuthenticationFailedException}.
 */
@NonNullByDefault
public class DaikinCloudApi {

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(DaikinCloudApi.class));

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String METHOD_POST = "POST";
    private static final String METHOD_PUT = "PUT";

    private final Endpoints ep;
    private final SessionManager sessionManager;
    private final HttpClient httpClient;
    private final Clock clock;
    private final Map<String, Map<String, String>> lastRawStatus = new ConcurrentHashMap<>();
    private volatile AuthorizationMode authorizationMode;

    public DaikinCloudApi(Endpoints ep, SessionManager sessionManager, HttpClient httpClient,
            AuthorizationMode authorizationMode, Clock clock) {
        this.ep = Objects.requireNonNull(ep, "endpoints");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.authorizationMode = Objects.requireNonNull(authorizationMode, "authorizationMode");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AuthorizationMode getAuthorizationMode() {
        return authorizationMode;
    }

    /**
     * Fetches the catalog of units on the account.
     *
     * @throws DiscoveryFailedException on transport errors or an unreadable answer
     */
    public List<Device> discoverDevices() throws DaikinException, InterruptedException {
        JsonArray requests = new JsonArray();
        requests.add(readRequest(PATH_EDGES_EXPAND));
        requests.add(readRequest(PATH_EDGES));

        JsonObject data;
        try {
            data = requireBody(multireq(METHOD_POST, requests), "Discovery request");
        } catch (IOException e) {
            throw new DiscoveryFailedException("Device discovery failed: " + e.getMessage(), e);
        }
        JsonArray responses = optArray(data, "responses");
        if (responses == null) {
            throw new DiscoveryFailedException("Discovery response did not contain any responses");
        }

        Map<String, EdgeInfo> edges = new LinkedHashMap<>();
        for (JsonElement element : responses) {
            if (element == null || !element.isJsonObject()) {
                continue;
            }
            JsonObject response = element.getAsJsonObject();
            String from = DsiotStatusMapper.optString(response, "fr");
            JsonElement pc = response.get("pc");
            if (from == null || pc == null) {
                continue;
            }
            if (PATH_EDGES.equals(from) || PATH_EDGES_EXPAND.equals(from)) {
                if (pc.isJsonArray()) {
                    for (JsonElement edge : pc.getAsJsonArray()) {
                        if (edge != null && edge.isJsonObject()) {
                            mergeEdge(edges, edge.getAsJsonObject(), null);
                        }
                    }
                } else if (pc.isJsonObject()) {
                    mergeEdge(edges, pc.getAsJsonObject(), null);
                }
            } else if (from.startsWith(PATH_EDGES + "/") && pc.isJsonObject()) {
                // Per-edge fragment: /dsiot/edges/{id}/...
                String[] parts = from.split("/");
                if (parts.length >= 4 && parts[3].chars().allMatch(Character::isDigit)) {
                    JsonObject wrapper = new JsonObject();
                    JsonArray children = new JsonArray();
                    children.add(pc);
                    wrapper.add("pch", children);
                    mergeEdge(edges, wrapper, parts[3]);
                }
            }
        }

        List<Device> devices = new ArrayList<>();
        for (Map.Entry<String, EdgeInfo> entry : edges.entrySet()) {
            EdgeInfo info = entry.getValue();
            String name = info.name;
            Set<Capability> capabilities = info.capabilities;
            devices.add(new Device(entry.getKey(), name != null ? name : "Daikin " + entry.getKey(),
                    info.mac != null ? info.mac : "", capabilities != null ? capabilities : Capability.all()));
        }
        logger.debug("Daikin discovery found {} units", devices.size());
        return devices;
    }

    /**
     * Reads the current status of one unit.
     *
     * @throws DeviceUnreachableException on transport errors or an unusable answer
     * @throws UnknownDeviceException if the cloud does not know the id
     */
    public DeviceStatusSnapshot fetchStatus(String deviceId) throws DaikinException, InterruptedException {
        JsonArray requests = new JsonArray();
        requests.add(readRequest(statusPath(deviceId) + "?filter=pv"));

        JsonObject data;
        try {
            JsonResponse response = multireq(METHOD_POST, requests);
            if (response.getStatusCode() == 404) {
                throw new UnknownDeviceException(deviceId);
            }
            data = requireBody(response, "Status request for " + deviceId);
        } catch (IOException e) {
            throw new DeviceUnreachableException("Status of " + deviceId + " unavailable: " + e.getMessage(), e);
        }

        JsonObject entry = findResponse(data, "/" + deviceId + "/" + STATUS_NODE);
        if (entry == null) {
            throw new DeviceUnreachableException("Status response for " + deviceId + " had no status entry");
        }
        Integer rsc = optInt(entry, "rsc");
        if (rsc != null && rsc.intValue() == RSC_NOT_FOUND) {
            throw new UnknownDeviceException(deviceId);
        }
        if (rsc != null && rsc.intValue() != RSC_OK) {
            throw new DeviceUnreachableException("Status request for " + deviceId + " answered rsc=" + rsc);
        }
        JsonElement pc = entry.get("pc");
        Map<String, String> raw = DsiotStatusMapper
                .flatten(pc != null && pc.isJsonObject() ? pc.getAsJsonObject() : null);
        if (raw == null) {
            throw new DeviceUnreachableException("Status response for " + deviceId + " had no status tree");
        }
        lastRawStatus.put(deviceId, raw);
        return DsiotStatusMapper.map(deviceId, raw, clock.instant());
    }

    /**
     * Submits a power and/or mode change. Fields the command does not target
     * are written with their last polled value; a unit that was never polled
     * is read first.
     *
     * @return {@code true} if the cloud accepted the write, {@code false} if it
     *         rejected it; acceptance does not mean the unit changed state
     * @throws CommandSubmissionFailedException if the write could not be
     *             delivered, or the current values of untargeted fields are
     *             not known
     */
    public boolean submitCommand(String deviceId, Command command) throws DaikinException, InterruptedException {
        Map<String, String> raw = currentRawStatus(deviceId, command);
        Boolean targetPower = command.getTargetPower();
        boolean power = targetPower != null ? targetPower.booleanValue() : POWER_ON.equals(raw.get(KEY_POWER));
        OperationMode mode = command.getTargetMode();
        if (mode == null) {
            mode = OperationMode.fromCode(raw.get(KEY_MODE));
            if (mode == OperationMode.UNKNOWN) {
                throw new CommandSubmissionFailedException("Device " + deviceId + " reports unrecognized mode "
                        + raw.get(KEY_MODE) + "; " + command + " would overwrite it");
            }
        }

        JsonObject request = new JsonObject();
        request.addProperty("op", OP_WRITE);
        request.addProperty("to", statusPath(deviceId));
        request.add("pc", DsiotStatusMapper.buildWritePayload(power, mode, raw));
        JsonArray requests = new JsonArray();
        requests.add(request);

        logger.debug("Submitting {} as power={} mode={}", command, power ? POWER_ON : POWER_OFF, mode);
        JsonObject data;
        try {
            data = requireBody(multireq(METHOD_PUT, requests), "Write request for " + deviceId);
        } catch (IOException e) {
            throw new CommandSubmissionFailedException("Submitting " + command + " failed: " + e.getMessage(), e);
        }

        JsonArray responses = optArray(data, "responses");
        if (responses == null || responses.isEmpty() || !responses.get(0).isJsonObject()) {
            logger.debug("Write for {} carried no result code; treating as accepted", deviceId);
            return true;
        }
        Integer rsc = optInt(responses.get(0).getAsJsonObject(), "rsc");
        if (rsc != null && (rsc.intValue() == RSC_OK || rsc.intValue() == RSC_ACCEPTED)) {
            return true;
        }
        logger.warn("Write for {} rejected with rsc={}", deviceId, rsc);
        return false;
    }

    private Map<String, String> currentRawStatus(String deviceId, Command command)
            throws DaikinException, InterruptedException {
        Map<String, String> raw = lastRawStatus.get(deviceId);
        if (raw != null) {
            return raw;
        }
        logger.debug("No status polled for {} yet, reading it before {}", deviceId, command);
        try {
            fetchStatus(deviceId);
        } catch (DeviceUnreachableException e) {
            throw new CommandSubmissionFailedException(
                    "Current status of " + deviceId + " unavailable, not submitting " + command, e);
        }
        return lastRawStatus.getOrDefault(deviceId, Map.of());
    }

    /**
     * Last raw status parameters polled for a unit, used to fill the write
     * template.
     */
    public Map<String, String> getLastRawStatus(String deviceId) {
        return lastRawStatus.getOrDefault(deviceId, Map.of());
    }

    public void forgetDevice(String deviceId) {
        lastRawStatus.remove(deviceId);
    }

    private JsonResponse multireq(String method, JsonArray requests)
            throws DaikinException, IOException, InterruptedException {
        JsonObject payload = new JsonObject();
        payload.add("requests", requests);
        String body = payload.toString();

        for (int attempt = 0; attempt < 2; attempt++) {
            Session session = sessionManager.ensureSession();
            for (AuthorizationMode mode : candidates(session)) {
                String token = token(session, mode);
                if (token == null) {
                    continue;
                }
                JsonResponse response = send(method, body, token);
                if (response.isUnauthorized()) {
                    logger.debug("Request unauthorized via {}", mode);
                    continue;
                }
                if (mode != authorizationMode) {
                    logger.debug("Daikin multireq authorized via {}", mode);
                    authorizationMode = mode;
                }
                sessionManager.reportAuthorized();
                return response;
            }
            logger.info("Request rejected as unauthorized with every token kind, invalidating session");
            sessionManager.invalidate(session);
        }
        throw new AuthenticationFailedException("Request unauthorized even after re-login");
    }

    protected JsonResponse send(String method, String body, String bearerToken)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(ep.multireqUrl())).timeout(REQUEST_TIMEOUT)
                .header("Accept", "*/*").header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + bearerToken)
                .method(method, HttpRequest.BodyPublishers.ofString(body));
        String userAgent = ep.userAgent;
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }
        HttpRequest request = builder.build();
        logRequest(request, body);
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String responseBody = response.body() != null ? response.body() : "";
        String bodyForLog = LogSanitizer.body(responseBody);
        logger.trace("Received HTTP {} from {} body={}", response.statusCode(), LogSanitizer.uri(request.uri()),
                bodyForLog);
        return new JsonResponse(response.statusCode(), responseBody, bodyForLog);
    }

    private void logRequest(HttpRequest request, String body) {
        if (!logger.isTraceEnabled()) {
            return;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        request.headers().map().forEach((name, values) -> headers.put(name,
                LogSanitizer.header(name, String.join(",", values))));
        logger.trace("Sending HTTP {} {} headers={} body={}", request.method(), LogSanitizer.uri(request.uri()),
                headers, LogSanitizer.body(body));
    }

    private List<AuthorizationMode> candidates(Session session) {
        List<AuthorizationMode> modes = new ArrayList<>();
        AuthorizationMode preferred = authorizationMode;
        if (token(session, preferred) != null) {
            modes.add(preferred);
        }
        if (token(session, preferred.other()) != null) {
            modes.add(preferred.other());
        }
        return modes;
    }

    private static @Nullable String token(Session session, AuthorizationMode mode) {
        String token = mode == AuthorizationMode.ID_TOKEN ? session.getIdToken() : session.getAccessToken();
        return token == null || token.isBlank() ? null : token;
    }

    private JsonObject requireBody(JsonResponse response, String context) throws IOException {
        if (!response.isSuccessful()) {
            logger.warn("{} failed (HTTP {}): {}", context, response.getStatusCode(), response.getBodyForLog());
            throw new IOException(String.format("%s failed (HTTP %d)", context, response.getStatusCode()));
        }
        JsonObject json = response.getBodyAsJson();
        if (json == null) {
            throw new IOException(context + " returned a body that is not a JSON object");
        }
        return json;
    }

    private static JsonObject readRequest(String path) {
        JsonObject request = new JsonObject();
        request.addProperty("op", OP_READ);
        request.addProperty("to", path);
        return request;
    }

    private static String statusPath(String deviceId) {
        return PATH_EDGES + "/" + deviceId + "/" + STATUS_NODE;
    }

    private static @Nullable JsonObject findResponse(JsonObject data, String fragment) {
        JsonArray responses = optArray(data, "responses");
        if (responses == null) {
            return null;
        }
        for (JsonElement element : responses) {
            if (element != null && element.isJsonObject()) {
                String from = DsiotStatusMapper.optString(element.getAsJsonObject(), "fr");
                if (from != null && from.contains(fragment)) {
                    return element.getAsJsonObject();
                }
            }
        }
        return null;
    }

    private static void mergeEdge(Map<String, EdgeInfo> edges, JsonObject edge, @Nullable String fallbackId) {
        String id = DsiotStatusMapper.optString(edge, "ri");
        if (id == null || id.isBlank()) {
            id = fallbackId;
        }
        if (id == null || id.isBlank()) {
            return;
        }
        EdgeInfo info = edges.computeIfAbsent(id.trim(), key -> new EdgeInfo());
        String name = leafValue(edge, NODE_ADAPTER_DESCRIPTION, "name");
        if (name != null && !name.isEmpty()) {
            info.name = name;
        }
        String mac = leafValue(edge, NODE_ADAPTER_INFO, "mac");
        if (mac != null && !mac.isEmpty()) {
            info.mac = mac;
        }
        if (DsiotStatusMapper.findByName(edge, NODE_STATUS_ROOT) != null) {
            info.capabilities = DsiotStatusMapper.capabilitiesOf(edge);
        }
    }

    private static @Nullable String leafValue(JsonObject edge, String group, String leaf) {
        JsonObject node = DsiotStatusMapper.childByName(edge, group);
        return DsiotStatusMapper.optString(DsiotStatusMapper.childByName(node, leaf), "pv");
    }

    private static @Nullable JsonArray optArray(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : null;
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

    private static final class EdgeInfo {
        @Nullable
        String name;
        @Nullable
        String mac;
        @Nullable
        Set<Capability> capabilities;
    }
}
