package org.openhab.binding.daikinsmartapp.internal.util;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tests for {@link EndpointResolver}.
 */
@NonNullByDefault
@SuppressWarnings("null")
class EndpointResolverTest {

    private static JsonNode root;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadDefaults() throws Exception {
        root = EndpointResolver.loadTree(EndpointResolverTest.class.getClassLoader(), null);
        assertNotNull(root, "Endpoint configuration should load from defaults");
    }

    @Test
    void defaultRegionResolvesCloudEndpoints() {
        EndpointResolver.Endpoints endpoints = EndpointResolver.resolve(root, "default");

        assertEquals("https://proddit.ditdeneb.com/premise/dsiot/login", endpoints.loginUrl());
        assertEquals("https://proddit.ditdeneb.com/dsiot/multireq", endpoints.multireqUrl());
        assertEquals(2, endpoints.credentialDiscoveryUrls.size());
        assertTrue(endpoints.userAgent.startsWith("DaikinMobileController/"));
    }

    @Test
    void unknownRegionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> EndpointResolver.resolve(root, "mars"));
    }

    @Test
    void overrideFileTakesPrecedence() throws Exception {
        Path override = tempDir.resolve("endpoints.json");
        Files.writeString(override, "{\"lab\":{\"baseUrl\":\"http://127.0.0.1:8080/\",\"loginPath\":\"login\","
                + "\"multireqPath\":\"/multireq\"}}", StandardCharsets.UTF_8);

        JsonNode custom = EndpointResolver.loadTree(getClass().getClassLoader(), override.toString());
        EndpointResolver.Endpoints endpoints = EndpointResolver.resolve(custom, "lab");

        assertEquals("http://127.0.0.1:8080/login", endpoints.loginUrl());
        assertEquals("http://127.0.0.1:8080/multireq", endpoints.multireqUrl());
        assertTrue(endpoints.credentialDiscoveryUrls.isEmpty());
    }

    @Test
    void incompleteRegionIsRejected() throws Exception {
        Path override = tempDir.resolve("broken.json");
        Files.writeString(override, "{\"lab\":{\"baseUrl\":\"http://127.0.0.1\"}}", StandardCharsets.UTF_8);

        JsonNode custom = EndpointResolver.loadTree(getClass().getClassLoader(), override.toString());

        assertThrows(IllegalArgumentException.class, () -> EndpointResolver.resolve(custom, "lab"));
    }
}
