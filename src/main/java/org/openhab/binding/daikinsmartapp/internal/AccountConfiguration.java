package org.openhab.binding.daikinsmartapp.internal;

import static org.openhab.binding.daikinsmartapp.internal.DaikinSmartAppBindingConstants.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public class AccountConfiguration {
    public String username = "";
    public String password = "";
    public String clientId = "";
    public String clientSecret = "";
    public String clientUuid = "";
    public String authMode = AUTH_MODE_ID_TOKEN;
    public String region = DEFAULT_REGION;
    public String endpointsOverride = "";
    public String storePath = "";
    public int refreshSeconds = DEFAULT_REFRESH_SECONDS;
    public int confirmationTimeoutSeconds = DEFAULT_CONFIRMATION_TIMEOUT_SECONDS;
    public int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
    public int sessionLifetimeMinutes = DEFAULT_SESSION_LIFETIME_MINUTES;
    public int sessionSafetyMarginSeconds = DEFAULT_SESSION_SAFETY_MARGIN_SECONDS;
    public int maxInvalidations = DEFAULT_MAX_INVALIDATIONS;
    public int invalidationWindowSeconds = DEFAULT_INVALIDATION_WINDOW_SECONDS;

    public static AccountConfiguration from(Map<String, ?> cfg) {
        AccountConfiguration c = new AccountConfiguration();
        c.username = string(cfg, CONFIG_USERNAME, "").trim();
        c.password = string(cfg, CONFIG_PASSWORD, "");
        c.clientId = string(cfg, CONFIG_CLIENT_ID, "").trim();
        c.clientSecret = string(cfg, CONFIG_CLIENT_SECRET, "").trim();
        c.clientUuid = string(cfg, CONFIG_CLIENT_UUID, "").trim();
        if (c.clientUuid.isEmpty()) {
            c.clientUuid = UUID.randomUUID().toString();
        }
        String mode = string(cfg, CONFIG_AUTH_MODE, AUTH_MODE_ID_TOKEN).trim().toLowerCase(Locale.ROOT);
        c.authMode = AUTH_MODE_ACCESS_TOKEN.equals(mode) ? AUTH_MODE_ACCESS_TOKEN : AUTH_MODE_ID_TOKEN;
        c.region = string(cfg, CONFIG_REGION, DEFAULT_REGION).trim();
        c.endpointsOverride = string(cfg, CONFIG_ENDPOINTS_OVERRIDE, "").trim();
        c.storePath = string(cfg, CONFIG_STORE_PATH, "").trim();

        c.refreshSeconds = Math.max(MIN_REFRESH_SECONDS, integer(cfg, CONFIG_REFRESH, DEFAULT_REFRESH_SECONDS));
        c.confirmationTimeoutSeconds = Math.max(1,
                integer(cfg, CONFIG_CONFIRMATION_TIMEOUT, DEFAULT_CONFIRMATION_TIMEOUT_SECONDS));
        c.failureThreshold = Math.max(1, integer(cfg, CONFIG_FAILURE_THRESHOLD, DEFAULT_FAILURE_THRESHOLD));
        c.sessionLifetimeMinutes = Math.max(1,
                integer(cfg, CONFIG_SESSION_LIFETIME, DEFAULT_SESSION_LIFETIME_MINUTES));
        c.sessionSafetyMarginSeconds = Math.max(0,
                integer(cfg, CONFIG_SESSION_SAFETY_MARGIN, DEFAULT_SESSION_SAFETY_MARGIN_SECONDS));
        c.maxInvalidations = Math.max(1, integer(cfg, CONFIG_MAX_INVALIDATIONS, DEFAULT_MAX_INVALIDATIONS));
        c.invalidationWindowSeconds = Math.max(1,
                integer(cfg, CONFIG_INVALIDATION_WINDOW, DEFAULT_INVALIDATION_WINDOW_SECONDS));
        return c;
    }

    public boolean hasCredentials() {
        return !username.isEmpty() && !password.isEmpty();
    }

    public Path resolveStorePath() {
        if (!storePath.isEmpty()) {
            return Path.of(storePath);
        }
        return Path.of(System.getProperty("java.io.tmpdir"), BINDING_ID, "account-" + clientUuid + ".json");
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(refreshSeconds);
    }

    public Duration confirmationTimeout() {
        return Duration.ofSeconds(confirmationTimeoutSeconds);
    }

    public Duration sessionLifetime() {
        return Duration.ofMinutes(sessionLifetimeMinutes);
    }

    public Duration sessionSafetyMargin() {
        return Duration.ofSeconds(sessionSafetyMarginSeconds);
    }

    public Duration invalidationWindow() {
        return Duration.ofSeconds(invalidationWindowSeconds);
    }

    private static String string(Map<String, ?> cfg, String key, String def) {
        Object value = cfg.get(key);
        return value == null ? def : String.valueOf(value);
    }

    private static int integer(Map<String, ?> cfg, String key, int def) {
        Object value = cfg.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }
}
