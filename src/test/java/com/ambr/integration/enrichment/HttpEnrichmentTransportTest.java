package com.ambr.integration.enrichment;

import com.ambr.core.enrich.EnrichmentResponse;
import com.ambr.core.enrich.MalformedEnrichmentResponseException;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpEnrichmentTransportTest {

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private volatile int replyStatus = 200;
    private volatile String replyBody = "{\"status\":true,\"data\":[]}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/enrich", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                requestBody.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            byte[] bytes = replyBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(replyStatus, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void postsSkusAndReadsAttributes() throws Exception {
        replyBody = """
            {"status": true, "data": [
              {"sku": "ABC-1", "color": "red", "weight": 1.5, "note": null},
              {"sku": "ABC-2", "color": "blue"}
            ]}
            """;

        EnrichmentResponse response = transport().fetch(List.of("ABC-1", "ABC-2"));

        JSONObject sent = new JSONObject(requestBody.get());
        assertEquals(List.of("ABC-1", "ABC-2"), sent.getJSONArray("skus").toList());
        assertTrue(response.status());
        assertEquals("red", response.data().get("ABC-1").get("color"));
        assertEquals("1.5", response.data().get("ABC-1").get("weight"));
        assertTrue(response.data().get("ABC-1").containsKey("note"));
        assertNull(response.data().get("ABC-1").get("note"));
        assertEquals("blue", response.data().get("ABC-2").get("color"));
    }

    @Test
    void nonSuccessStatusIsTransportFailure() {
        replyStatus = 503;
        replyBody = "busy";

        IOException ex = assertThrows(IOException.class, () -> transport().fetch(List.of("ABC-1")));

        assertFalse(ex instanceof MalformedEnrichmentResponseException);
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    void statusFalseIsReportedNotThrown() throws Exception {
        EnrichmentResponse response = HttpEnrichmentTransport.parse("{\"status\": false}");

        assertFalse(response.status());
    }

    @Test
    void unexpectedShapesAreMalformed() {
        assertThrows(MalformedEnrichmentResponseException.class, () -> HttpEnrichmentTransport.parse(""));
        assertThrows(MalformedEnrichmentResponseException.class, () -> HttpEnrichmentTransport.parse("not json"));
        assertThrows(MalformedEnrichmentResponseException.class, () -> HttpEnrichmentTransport.parse("{\"data\": []}"));
        assertThrows(MalformedEnrichmentResponseException.class, () -> HttpEnrichmentTransport.parse("{\"status\": true}"));
        assertThrows(MalformedEnrichmentResponseException.class,
            () -> HttpEnrichmentTransport.parse("{\"status\": true, \"data\": [{\"color\": \"red\"}]}"));
    }

    @Test
    void duplicateSkuKeepsFirstBag() throws Exception {
        EnrichmentResponse response = HttpEnrichmentTransport.parse(
            "{\"status\": true, \"data\": [{\"sku\": \"A\", \"n\": 1}, {\"sku\": \"A\", \"n\": 2}]}");

        assertEquals(Map.of("sku", "A", "n", "1"), response.data().get("A"));
    }

    private HttpEnrichmentTransport transport() {
        URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/enrich");
        return new HttpEnrichmentTransport(endpoint, Duration.ofSeconds(5));
    }
}
