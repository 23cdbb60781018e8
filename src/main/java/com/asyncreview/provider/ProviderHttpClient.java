package com.asyncreview.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Thin GET-only HTTP helper shared by the providers. Every request carries the
 * configured timeout.
 */
public class ProviderHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public ProviderHttpClient(Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout);
    }

    ProviderHttpClient(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.timeout = timeout;
    }

    /**
     * GETs and parses a JSON document.
     *
     * @throws TransientProviderException on I/O failure, timeout or a non-2xx status
     */
    public JsonNode getJson(String url, Map<String, String> headers) {
        HttpResponse<String> response = send(url, headers);
        if (response.statusCode() / 100 != 2) {
            throw new TransientProviderException(
                    "GET " + url + " returned " + response.statusCode(), response.statusCode());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new TransientProviderException("GET " + url + " returned invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * GETs a text document; empty when the server answers 404.
     *
     * @throws TransientProviderException on I/O failure, timeout or any other non-2xx status
     */
    public Optional<String> getText(String url, Map<String, String> headers) {
        HttpResponse<String> response = send(url, headers);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() / 100 != 2) {
            throw new TransientProviderException(
                    "GET " + url + " returned " + response.statusCode(), response.statusCode());
        }
        return Optional.of(response.body());
    }

    private HttpResponse<String> send(String url, Map<String, String> headers) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET();
        headers.forEach(builder::header);
        try {
            log.debug("GET {}", url);
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientProviderException("GET " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProviderException("GET " + url + " interrupted", e);
        }
    }

    /** Form-style encoding, as used for GitLab project and file paths. */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** Encodes each {@code /}-separated segment of a path, keeping the separators. */
    public static String encodePath(String path) {
        var joiner = new StringJoiner("/");
        for (String segment : path.split("/", -1)) {
            joiner.add(encode(segment).replace("+", "%20"));
        }
        return joiner.toString();
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? "" : value.asText();
    }
}
