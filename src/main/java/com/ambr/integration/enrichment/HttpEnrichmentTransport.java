package com.ambr.integration.enrichment;

import com.ambr.core.enrich.EnrichmentResponse;
import com.ambr.core.enrich.EnrichmentTransport;
import com.ambr.core.enrich.MalformedEnrichmentResponseException;
import com.ambr.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Posts {@code {"skus":[...]}} to the enrichment endpoint and reads
 * {@code {"status":true,"data":[{"sku":"...", ...}]}} back.
 */
public class HttpEnrichmentTransport implements EnrichmentTransport {
    private static final Logger LOGGER = AppLogger.get();

    static final String REQUEST_KEY = "skus";
    static final String STATUS_KEY = "status";
    static final String DATA_KEY = "data";
    static final String SKU_KEY = "sku";

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration requestTimeout;

    public HttpEnrichmentTransport(URI endpoint, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(requestTimeout)
                .build(),
            endpoint, requestTimeout);
    }

    public HttpEnrichmentTransport(HttpClient httpClient, URI endpoint, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public EnrichmentResponse fetch(List<String> skus) throws IOException, InterruptedException {
        String body = new JSONObject().put(REQUEST_KEY, new JSONArray(skus)).toString();
        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException ex) {
            throw new IOException("Enrichment request timed out after " + requestTimeout.toMillis() + " ms", ex);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Enrichment service responded with HTTP " + status);
        }
        LOGGER.fine(() -> "Enrichment reply for %d SKU(s): %d byte(s)".formatted(skus.size(), response.body().length()));
        return parse(response.body());
    }

    static EnrichmentResponse parse(String body) throws MalformedEnrichmentResponseException {
        if (body == null || body.isBlank()) {
            throw new MalformedEnrichmentResponseException("empty body");
        }
        try {
            JSONObject root = new JSONObject(body);
            if (!root.has(STATUS_KEY)) {
                throw new MalformedEnrichmentResponseException("missing '" + STATUS_KEY + "'");
            }
            if (!root.getBoolean(STATUS_KEY)) {
                return EnrichmentResponse.failed();
            }
            JSONArray data = root.optJSONArray(DATA_KEY);
            if (data == null) {
                throw new MalformedEnrichmentResponseException("missing '" + DATA_KEY + "' array");
            }
            Map<String, Map<String, String>> bySku = new LinkedHashMap<>();
            for (int i = 0; i < data.length(); i++) {
                JSONObject element = data.optJSONObject(i);
                if (element == null || !element.has(SKU_KEY) || element.isNull(SKU_KEY)) {
                    throw new MalformedEnrichmentResponseException("data element " + i + " has no '" + SKU_KEY + "'");
                }
                Map<String, String> attributes = new LinkedHashMap<>();
                for (String key : element.keySet()) {
                    Object value = element.get(key);
                    attributes.put(key, JSONObject.NULL.equals(value) ? null : String.valueOf(value));
                }
                bySku.putIfAbsent(element.get(SKU_KEY).toString(), attributes);
            }
            return EnrichmentResponse.ok(bySku);
        } catch (JSONException ex) {
            throw new MalformedEnrichmentResponseException("invalid JSON: " + ex.getMessage(), ex);
        }
    }
}
