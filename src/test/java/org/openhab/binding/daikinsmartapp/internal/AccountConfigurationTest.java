package org.openhab.binding.daikinsmartapp.internal;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AccountConfiguration}.
 */
@NonNullByDefault
class AccountConfigurationTest {

    @Test
    void defaultsApplyToEmptyConfiguration() {
        AccountConfiguration cfg = AccountConfiguration.from(Map.of());

        assertFalse(cfg.hasCredentials());
        assertEquals(Duration.ofSeconds(30), cfg.pollInterval());
        assertEquals(Duration.ofSeconds(90), cfg.confirmationTimeout());
        assertEquals(3, cfg.failureThreshold);
        assertEquals(Duration.ofMinutes(50), cfg.sessionLifetime());
        assertEquals(Duration.ofSeconds(60), cfg.sessionSafetyMargin());
        assertEquals(3, cfg.maxInvalidations);
        assertEquals(Duration.ofSeconds(300), cfg.invalidationWindow());
        assertEquals("id_token", cfg.authMode);
        assertEquals("default", cfg.region);
        assertFalse(cfg.clientUuid.isEmpty(), "a client uuid is generated when none is configured");
    }

    @Test
    void valuesAreParsedLeniently() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("username", "  user@example.com ");
        raw.put("password", "secret");
        raw.put("refresh", "45");
        raw.put("confirmationTimeout", Integer.valueOf(120));
        raw.put("failureThreshold", "not a number");
        raw.put("authMode", "ACCESS_TOKEN");
        raw.put("clientUuid", "fixed-uuid");
        raw.put("storePath", "/var/lib/daikin/account.json");

        AccountConfiguration cfg = AccountConfiguration.from(raw);

        assertTrue(cfg.hasCredentials());
        assertEquals("user@example.com", cfg.username);
        assertEquals(Duration.ofSeconds(45), cfg.pollInterval());
        assertEquals(Duration.ofSeconds(120), cfg.confirmationTimeout());
        assertEquals(3, cfg.failureThreshold);
        assertEquals("access_token", cfg.authMode);
        assertEquals(Path.of("/var/lib/daikin/account.json"), cfg.resolveStorePath());
    }

    @Test
    void pollIntervalHasLowerBound() {
        AccountConfiguration cfg = AccountConfiguration.from(Map.of("refresh", "1"));

        assertEquals(Duration.ofSeconds(10), cfg.pollInterval());
    }

    @Test
    void defaultStorePathIsDerivedFromClientUuid() {
        AccountConfiguration cfg = AccountConfiguration.from(Map.of("clientUuid", "abc"));

        assertTrue(cfg.resolveStorePath().endsWith(Path.of("daikinsmartapp", "account-abc.json")));
    }
}
