package io.seatwatch.notify;

import io.seatwatch.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public final class WebhookNotifier implements Notifier {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookNotifier.class);
    static final String USERNAME = "SeatWatch";

    private final HttpClient http;
    private final URI endpoint;
    private final Duration timeout;

    public WebhookNotifier(HttpClient http, String webhookUrl, Duration timeout) {
        this.http = http;
        this.endpoint = URI.create(webhookUrl.trim());
        this.timeout = timeout;
    }

    public WebhookNotifier(String webhookUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), webhookUrl, timeout);
    }

    @Override
    public void notify(String message) {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload(message), StandardCharsets.UTF_8))
                .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() / 100 != 2) {
                LOG.error("Webhook rejected notification: status={}", response.statusCode());
                return;
            }
            LOG.debug("Webhook notification sent");
        } catch (IOException e) {
            LOG.error("Could not send webhook notification: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Webhook notification interrupted");
        }
    }

    static String payload(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", message);
        body.put("username", USERNAME);
        return Jsons.toCompactJson(body);
    }
}
