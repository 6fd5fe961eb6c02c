package com.hivemind.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.error.PermissionDeniedException;
import com.hivemind.core.error.PlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the platform's REST table API ({@code /api/now/table/<table>}).
 *
 * <p>Authenticates with basic credentials from {@link HivemindProperties.Platform}. HTTP 401
 * and 403 become {@link PermissionDeniedException} so the coordinator can remediate them;
 * other error statuses and transport failures become {@link PlatformException}.
 */
public class TablePlatformClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(TablePlatformClient.class);

    private final HivemindProperties.Platform settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TablePlatformClient(HivemindProperties.Platform settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    TablePlatformClient(HivemindProperties.Platform settings, ObjectMapper objectMapper, HttpClient httpClient) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public boolean isConfigured() {
        return settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()
                && settings.getUsername() != null && !settings.getUsername().isBlank();
    }

    @Override
    public String createRecord(String table, Map<String, ?> fields) {
        JsonNode response = send("create", table, tablePath(table), "POST", toJson(fields));
        JsonNode sysId = response.path("result").path("sys_id");
        if (sysId.isMissingNode() || sysId.asText().isBlank()) {
            throw new PlatformException("Platform created a record in " + table + " but returned no sys_id", 201);
        }
        log.info("Created record {} in {}", sysId.asText(), table);
        return sysId.asText();
    }

    @Override
    public Optional<JsonNode> getRecord(String table, String recordId) {
        try {
            return Optional.of(send("read", table, tablePath(table) + "/" + encode(recordId), "GET", null)
                    .path("result"));
        } catch (PlatformException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public JsonNode updateRecord(String table, String recordId, Map<String, ?> fields) {
        JsonNode response = send("update", table, tablePath(table) + "/" + encode(recordId), "PATCH", toJson(fields));
        log.info("Updated record {} in {}", recordId, table);
        return response.path("result");
    }

    JsonNode send(String operation, String table, String path, String method, String body) {
        if (!isConfigured()) {
            throw new PlatformException("Platform endpoint is not configured (hivemind.platform.base-url)", -1);
        }
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(settings.getBaseUrl()) + path))
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .header("Authorization", basicAuth())
                .header("Accept", "application/json");
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PlatformException("Platform request failed: %s %s".formatted(method, path), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException("Platform request interrupted: %s %s".formatted(method, path), e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            log.warn("Platform denied {} on {} (HTTP {})", operation, table, status);
            throw new PermissionDeniedException(operation, table,
                    "Platform denied %s on %s (HTTP %d): %s".formatted(operation, table, status, response.body()));
        }
        if (status >= 400) {
            throw new PlatformException("Platform %s %s failed (HTTP %d): %s"
                    .formatted(method, path, status, response.body()), status);
        }
        try {
            String text = response.body();
            return text == null || text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new PlatformException("Platform returned invalid JSON for %s %s".formatted(method, path), e);
        }
    }

    private String toJson(Map<String, ?> fields) {
        try {
            return objectMapper.writeValueAsString(fields != null ? fields : Map.of());
        } catch (JsonProcessingException e) {
            throw new PlatformException("Could not serialize record fields", e);
        }
    }

    private String basicAuth() {
        String password = settings.getPassword() != null ? settings.getPassword() : "";
        String credentials = settings.getUsername() + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String tablePath(String table) {
        return "/api/now/table/" + encode(table);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
