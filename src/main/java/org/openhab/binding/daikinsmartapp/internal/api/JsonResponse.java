package org.openhab.binding.daikinsmartapp.internal.api;

import java.util.Objects;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Represents a JSON response from the Daikin cloud.
 */
public class JsonResponse {
    private final int statusCode;
    private final String body;
    private final String bodyForLog;

    public JsonResponse(int statusCode, String body, String bodyForLog) {
        this.statusCode = statusCode;
        this.body = body;
        this.bodyForLog = bodyForLog;
    }

    /**
     * Returns the body as an object, or {@code null} if it is not a JSON object.
     */
    public JsonObject getBodyAsJson() {
        String b = body;
        if (b != null && !b.isEmpty()) {
            try {
                JsonElement parsed = JsonParser.parseString(b);
                if (parsed != null && parsed.isJsonObject()) {
                    return Objects.requireNonNull(parsed.getAsJsonObject());
                }
            } catch (RuntimeException e) {
                return null;
            }
        }
        return null;
    }

    public String getBody() {
        return body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBodyForLog() {
        return bodyForLog;
    }

    public boolean isSuccessful() {
        return statusCode / 100 == 2;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }
}
