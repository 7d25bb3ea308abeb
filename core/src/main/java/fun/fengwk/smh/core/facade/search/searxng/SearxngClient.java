package fun.fengwk.smh.core.facade.search.searxng;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * SearXNG HTTP client.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SearxngClient {

    private static final String SEARCH_PATH = "/search";
    private static final String CONFIG_PATH = "/config";

    private final SearxngProperties properties;
    private final HttpClient httpClient;

    public SearxngClient(SearxngProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    public SearxngClientResponse search(Map<String, String> params) {
        // Build request parameters with default format.
        Map<String, String> form = new LinkedHashMap<>();
        if (params != null) {
            form.putAll(params);
        }
        form.putIfAbsent("format", "json");

        boolean useGet = "GET".equalsIgnoreCase(properties.getMethod());
        String formBody = buildFormBody(form);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(buildUri(SEARCH_PATH, useGet ? formBody : null))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Accept", "application/json");

        if (useGet) {
            builder.GET();
        } else {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                .POST(BodyPublishers.ofString(formBody));
        }
        return send(builder.build());
    }

    /**
     * Fetch instance configuration (categories, engines).
     */
    public SearxngClientResponse fetchConfig() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(buildUri(CONFIG_PATH, null))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Accept", "application/json")
            .GET()
            .build();
        return send(request);
    }

    private SearxngClientResponse send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return SearxngClientResponse.builder()
                .statusCode(response.statusCode())
                .headers(response.headers().map())
                .body(response.body())
                .build();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return SearxngClientResponse.builder().error(ex).build();
        } catch (IOException | RuntimeException ex) {
            log.debug("searxng request failed, uri={}, error={}", request.uri(), ex.getMessage());
            return SearxngClientResponse.builder().error(ex).build();
        }
    }

    private URI buildUri(String path, String queryString) {
        String baseUrl = StringUtils.hasText(properties.getBaseUrl())
            ? properties.getBaseUrl().trim()
            : "";
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        if (!StringUtils.hasText(queryString)) {
            return URI.create(baseUrl + path);
        }
        return URI.create(baseUrl + path + "?" + queryString);
    }

    private String buildFormBody(Map<String, String> form) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : form.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            String value = URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8);
            joiner.add(key + "=" + value);
        }
        return joiner.toString();
    }

}
