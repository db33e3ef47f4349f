package com.changesentinel.service.notify;

import com.changesentinel.core.error.NotificationException;
import com.changesentinel.core.util.JsonUtils;
import com.changesentinel.pipeline.notify.NotificationTransport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class WebhookTransport implements NotificationTransport {
    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;

    public WebhookTransport(HttpClient httpClient, URI endpoint, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public void deliver(String destination, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("destination", destination);
        payload.put("message", message);
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(payload)))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotificationException("Webhook delivery to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while delivering to " + endpoint, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new NotificationException("Webhook " + endpoint + " answered with status " + response.statusCode());
        }
    }
}
