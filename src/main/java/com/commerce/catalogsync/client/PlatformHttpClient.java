package com.commerce.catalogsync.client;

import com.commerce.catalogsync.exception.AuthFailedException;
import com.commerce.catalogsync.exception.PlatformApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON over HTTP for one platform.
 * <p>
 * 2xx responses are parsed into a {@link JsonNode}. Anything else becomes a
 * {@link PlatformApiException}: 401/403 as {@link AuthFailedException}, 429 and 5xx flagged
 * retryable, other statuses not.
 */
@Slf4j
public class PlatformHttpClient {

    private final String platformName;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public PlatformHttpClient(String platformName, HttpClient httpClient, ObjectMapper objectMapper,
                              Duration requestTimeout) {
        this.platformName = platformName;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    public static PlatformHttpClient create(String platformName, ObjectMapper objectMapper,
                                            Duration connectTimeout, Duration requestTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
        return new PlatformHttpClient(platformName, httpClient, objectMapper, requestTimeout);
    }

    public JsonNode get(String url, Map<String, ?> params, Map<String, String> headers) {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .GET()
                .uri(URI.create(url + toQueryString(params)))
                .timeout(requestTimeout);
        headers.forEach(requestBuilder::header);
        return send(requestBuilder.build());
    }

    public JsonNode put(String url, Object body, Map<String, String> headers) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PlatformApiException("Failed to serialize request body for " + url, platformName, e, false);
        }

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .PUT(HttpRequest.BodyPublishers.ofString(json))
                .uri(URI.create(url))
                .timeout(requestTimeout);
        headers.forEach(requestBuilder::header);
        requestBuilder.header("Content-Type", "application/json");
        return send(requestBuilder.build());
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PlatformApiException(String.format("%s %s failed: %s",
                    request.method(), request.uri(), e.getMessage()), platformName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformApiException(String.format("%s %s interrupted",
                    request.method(), request.uri()), platformName, e, false);
        }

        int status = response.statusCode();
        log.debug("{} request to {} returned status code: {}", request.method(), request.uri(), status);

        if (status == 401 || status == 403) {
            throw new AuthFailedException(String.format("%s rejected credentials (HTTP %d) for %s %s",
                    platformName, status, request.method(), request.uri()), platformName, status);
        }
        if (status < 200 || status >= 300) {
            boolean retryable = status == 429 || status >= 500;
            throw new PlatformApiException(String.format("%s %s returned HTTP %d: %s",
                    request.method(), request.uri(), status, abbreviate(response.body())),
                    platformName, status, retryable);
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PlatformApiException(String.format("%s %s returned malformed JSON",
                    request.method(), request.uri()), platformName, e, false);
        }
    }

    private static String toQueryString(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(String.valueOf(e.getValue())))
                .collect(Collectors.joining("&", "?", ""));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
