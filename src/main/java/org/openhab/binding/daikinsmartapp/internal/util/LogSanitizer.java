package org.openhab.binding.daikinsmartapp.internal.util;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Redacts secrets from request and response bodies before they are logged.
 */
@NonNullByDefault
public final class LogSanitizer {

    public static final String REDACTED_VALUE = "***REDACTED***";

    private static final int MAX_BODY_LENGTH = 512;
    private static final Set<String> SENSITIVE_JSON_FIELDS = Set.of("password", "access_token", "id_token",
            "refresh_token", "client_secret", "clientsecret");
    private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "cookie");
    private static final Pattern TEXT_SECRET_PATTERN = Pattern.compile(
            "((?:access|refresh|id)_token|client_?secret|password)([\"'\\s:=]+)([^\"'&\\s,}]+)",
            Pattern.CASE_INSENSITIVE);

    private LogSanitizer() {
    }

    public static String body(@Nullable String body) {
        if (body == null) {
            return "<none>";
        }
        String trimmed = body.trim();
        if (trimmed.isEmpty()) {
            return "<empty>";
        }
        String sanitized;
        try {
            JsonElement element = Objects.requireNonNull(JsonParser.parseString(trimmed));
            if (element.isJsonObject() || element.isJsonArray()) {
                sanitizeJsonElement(element);
                sanitized = element.toString();
            } else {
                sanitized = text(trimmed);
            }
        } catch (RuntimeException e) {
            sanitized = text(trimmed);
        }
        if (sanitized.length() > MAX_BODY_LENGTH) {
            sanitized = sanitized.substring(0, MAX_BODY_LENGTH) + "...";
        }
        return sanitized;
    }

    public static String text(String value) {
        return TEXT_SECRET_PATTERN.matcher(value).replaceAll("$1$2" + REDACTED_VALUE);
    }

    public static String header(String name, String value) {
        return SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT)) ? REDACTED_VALUE : value;
    }

    public static String uri(@Nullable URI uri) {
        return uri == null ? "null" : text(uri.toString());
    }

    private static void sanitizeJsonElement(JsonElement element) {
        if (element instanceof JsonObject) {
            JsonObject obj = (JsonObject) element;
            for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
                if (SENSITIVE_JSON_FIELDS.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                    entry.setValue(new JsonPrimitive(REDACTED_VALUE));
                } else {
                    sanitizeJsonElement(Objects.requireNonNull(entry.getValue()));
                }
            }
        } else if (element instanceof JsonArray) {
            for (JsonElement child : (JsonArray) element) {
                sanitizeJsonElement(Objects.requireNonNull(child));
            }
        }
    }
}
