package org.openhab.binding.daikinsmartapp.internal.util;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class EndpointResolver {
    public static class Endpoints {
        public String baseUrl;
        public String loginPath;
        public String multireqPath;
        public String userAgent;
        public List<String> credentialDiscoveryUrls = new ArrayList<>();

        public String loginUrl() {
            return join(baseUrl, loginPath);
        }

        public String multireqUrl() {
            return join(baseUrl, multireqPath);
        }

        private static String join(String base, String path) {
            String trimmedBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
            return path.startsWith("/") ? trimmedBase + path : trimmedBase + "/" + path;
        }
    }

    public static JsonNode loadTree(ClassLoader cl, String overridePath) throws Exception {
        ObjectMapper om = new ObjectMapper();
        if (overridePath != null && !overridePath.isBlank()) {
            Path p = Path.of(overridePath);
            if (Files.exists(p)) {
                try (InputStream in = Files.newInputStream(p)) {
                    return om.readTree(in);
                }
            }
        }
        try (InputStream in = cl.getResourceAsStream("OH-INF/endpoints-defaults.json")) {
            if (in == null) throw new IllegalStateException("endpoints-defaults.json not found in resources");
            return om.readTree(in);
        }
    }

    public static Endpoints resolve(JsonNode root, String region) {
        JsonNode n = root.path(region);
        if (n.isMissingNode()) throw new IllegalArgumentException("No endpoints for region=" + region);
        Endpoints e = new Endpoints();
        e.baseUrl = text(n, "baseUrl");
        e.loginPath = text(n, "loginPath");
        e.multireqPath = text(n, "multireqPath");
        e.userAgent = text(n, "userAgent");
        if (e.baseUrl == null || e.loginPath == null || e.multireqPath == null) {
            throw new IllegalArgumentException("Incomplete endpoints for region=" + region);
        }
        for (JsonNode url : n.path("credentialDiscoveryUrls")) {
            String value = url.asText(null);
            if (value != null && !value.isBlank()) {
                e.credentialDiscoveryUrls.add(value);
            }
        }
        return e;
    }

    private static String text(JsonNode n, String... path) {
        JsonNode cur = n;
        for (String p : path) {
            cur = cur.path(p);
        }
        return cur.isMissingNode() ? null : cur.asText(null);
    }
}
