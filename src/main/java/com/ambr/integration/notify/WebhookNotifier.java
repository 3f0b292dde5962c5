package com.ambr.integration.notify;

import com.ambr.core.report.Notifier;
import com.ambr.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Posts the run summary to a chat webhook as a single embed.
 */
public class WebhookNotifier implements Notifier {
    private static final Logger LOGGER = AppLogger.get();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    static final int EMBED_COLOR = 0x00FF00;

    private final HttpClient httpClient;
    private final URI webhook;

    public WebhookNotifier(URI webhook) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build(),
            webhook);
    }

    public WebhookNotifier(HttpClient httpClient, URI webhook) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.webhook = Objects.requireNonNull(webhook, "webhook");
    }

    @Override
    public void send(String title, String summary) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(webhook)
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload(title, summary), StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Webhook responded with HTTP " + status);
        }
        LOGGER.info("Posted run summary to webhook (HTTP %d).".formatted(status));
    }

    static String payload(String title, String summary) {
        JSONObject embed = new JSONObject()
            .put("title", title)
            .put("description", summary)
            .put("color", EMBED_COLOR);
        return new JSONObject()
            .put("embeds", new JSONArray().put(embed))
            .toString();
    }
}
