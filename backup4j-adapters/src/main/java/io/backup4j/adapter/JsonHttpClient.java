package io.backup4j.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON-over-HTTP client for the REST-speaking sources.
 *
 * <p>Every call returns the parsed body of a 2xx response; any other status raises
 * {@link HttpStatusException} carrying the status and the (truncated) body.
 */
public class JsonHttpClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);
    private static final int MAX_ERROR_BODY = 512;

    private final URI baseUri;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JsonHttpClient(String baseUrl, Map<String, String> headers, ObjectMapper objectMapper) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.headers = Map.copyOf(headers);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static Map<String, String> basicAuth(String login, String password) {
        String token = Base64.getEncoder().encodeToString((login + ":" + password).getBytes(StandardCharsets.UTF_8));
        Map<String, String> h = new LinkedHashMap<>();
        h.put("Authorization", "Basic " + token);
        return h;
    }

    public JsonNode get(String path) throws IOException, InterruptedException {
        return send("GET", path, null, "application/json");
    }

    public JsonNode post(String path, Object body) throws IOException, InterruptedException {
        return send("POST", path, objectMapper.writeValueAsString(body), "application/json");
    }

    public JsonNode put(String path, Object body) throws IOException, InterruptedException {
        return send("PUT", path, body == null ? null : objectMapper.writeValueAsString(body), "application/json");
    }

    public JsonNode delete(String path) throws IOException, InterruptedException {
        return send("DELETE", path, null, "application/json");
    }

    /**
     * Send a pre-serialised body, e.g. newline-delimited JSON.
     */
    public JsonNode sendRaw(String method, String path, String body, String contentType)
            throws IOException, InterruptedException {
        return send(method, path, body, contentType);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private JsonNode send(String method, String path, String body, String contentType)
            throws IOException, InterruptedException {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        HttpRequest.Builder request = HttpRequest.newBuilder(baseUri.resolve(relative))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (body != null) {
            request.header("Content-Type", contentType);
        }
        headers.forEach(request::header);

        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new HttpStatusException(method, path, status, truncate(response.body()));
        }
        String text = response.body();
        return text == null || text.isBlank() ? objectMapper.nullNode() : objectMapper.readTree(text);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }

    /**
     * Non-2xx answer from the remote service.
     */
    public static class HttpStatusException extends IOException {
        private final int status;

        public HttpStatusException(String method, String path, int status, String body) {
            super(method + " " + path + " returned HTTP " + status + (body.isEmpty() ? "" : ": " + body));
            this.status = status;
        }

        public int status() {
            return status;
        }
    }
}
