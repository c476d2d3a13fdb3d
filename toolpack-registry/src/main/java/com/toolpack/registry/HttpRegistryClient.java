package com.toolpack.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.toolpack.model.ToolJson;
import com.toolpack.model.ToolListing;
import com.toolpack.model.ToolPayload;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link RegistryClient} over HTTP/JSON using {@link HttpClient}.
 * Endpoints are resolved against the base URL, e.g. {@code http://localhost:8000/tools/list}.
 */
public final class HttpRegistryClient implements RegistryClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRegistryClient.class);

    private static final String UPLOAD_PATH = "/tools/upload";
    private static final String DOWNLOAD_PATH = "/tools/download";
    private static final String LIST_PATH = "/tools/list";
    private static final String CHECK_UPDATES_PATH = "/tools/check_updates";
    private static final TypeReference<List<ToolListing>> LISTING_TYPE = new TypeReference<>() {};

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    /**
     * @param baseUrl        registry base URL (e.g. "http://localhost:8000"); trailing slashes are ignored
     * @param requestTimeout per-request timeout
     */
    public HttpRegistryClient(String baseUrl, Duration requestTimeout) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : "http://localhost:8000";
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.baseUrl = url;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void upload(ToolPayload payload) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + UPLOAD_PATH))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(ToolJson.toJsonBytes(payload)))
                .build();
        send(request);
        log.info("Tool {}/{} (v{}) uploaded successfully.", payload.getAuthor(), payload.getName(), payload.getVersion());
    }

    @Override
    public ToolPayload download(String author, String name, String version) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("author", author);
        params.put("name", name);
        if (version != null) {
            params.put("version", version);
        }
        String body = send(get(DOWNLOAD_PATH, params));
        ToolPayload payload = parse(body, DOWNLOAD_PATH, ToolPayload.class);
        if (payload.getVersion() == null && version != null) {
            payload = payload.withVersion(version);
        }
        return payload;
    }

    @Override
    public List<ToolListing> list() {
        String body = send(get(LIST_PATH, Map.of()));
        try {
            return ToolJson.mapper().readValue(body, LISTING_TYPE);
        } catch (IOException e) {
            throw new RegistryException("Unreadable response from " + LIST_PATH + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean checkUpdates(String author, String name, String currentVersion) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("author", author);
        params.put("name", name);
        params.put("current_version", currentVersion);
        JsonNode root = parse(send(get(CHECK_UPDATES_PATH, params)), CHECK_UPDATES_PATH, JsonNode.class);
        JsonNode flag = root.path("update_available");
        if (!flag.isBoolean()) {
            throw new RegistryException("Response from " + CHECK_UPDATES_PATH + " lacks update_available", 200);
        }
        return flag.asBoolean();
    }

    private HttpRequest get(String path, Map<String, String> params) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path + query(params)))
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();
    }

    static String query(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        for (Map.Entry<String, String> e : params.entrySet()) {
            String value = e.getValue() != null ? e.getValue() : "";
            joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    private String send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RegistryException("Registry request failed: " + request.method() + " " + request.uri()
                    + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException("Interrupted during registry request " + request.uri(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new RegistryException("Registry error: " + status + " " + request.method() + " "
                    + request.uri() + " " + response.body(), status);
        }
        return response.body();
    }

    private static <T> T parse(String body, String path, Class<T> type) {
        try {
            T value = ToolJson.mapper().readValue(body, type);
            if (value == null) {
                throw new RegistryException("Empty response from " + path, 200);
            }
            return value;
        } catch (IOException e) {
            throw new RegistryException("Unreadable response from " + path + ": " + e.getMessage(), e);
        }
    }
}
