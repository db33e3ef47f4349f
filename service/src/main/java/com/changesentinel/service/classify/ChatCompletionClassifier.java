package com.changesentinel.service.classify;

import com.changesentinel.core.error.ContentParseException;
import com.changesentinel.core.error.FetchTimeoutException;
import com.changesentinel.core.error.HttpStatusException;
import com.changesentinel.core.error.NetworkException;
import com.changesentinel.core.model.Classification;
import com.changesentinel.core.util.JsonUtils;
import com.changesentinel.pipeline.notify.Classifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ChatCompletionClassifier implements Classifier {
    static final String SYSTEM_PROMPT = "You classify notices. Decide whether the notice announces a registration, "
            + "application or sign-up window. Reply with JSON only: "
            + "{\"relevant\": true|false, \"start_date\": \"YYYY-MM-DD\" or null, \"end_date\": \"YYYY-MM-DD\" or null}.";
    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public ChatCompletionClassifier(HttpClient httpClient, String baseUrl, String apiKey, String model, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = URI.create(stripTrailingSlash(baseUrl) + "/chat/completions");
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public Classification classify(String title, String content) {
        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", 0,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", "Title: " + title + "\n\n" + content)
                )
        );
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(body)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchTimeoutException(endpoint.toString(), e);
        } catch (IOException e) {
            throw new NetworkException(endpoint.toString(), "Classifier request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(endpoint.toString(), "Interrupted while classifying", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new HttpStatusException(endpoint.toString(), response.statusCode());
        }
        return parseReply(response.body());
    }

    static Classification parseReply(String responseBody) {
        JsonNode root = readJson(responseBody, "Classifier response is not JSON");
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ContentParseException("Classifier response has no message content");
        }
        JsonNode verdict = readJson(unfence(content.asText()), "Classifier reply is not JSON: " + content.asText());
        JsonNode relevant = verdict.has("relevant") ? verdict.get("relevant") : verdict.path("is_registration");
        if (!relevant.isBoolean()) {
            throw new ContentParseException("Classifier reply lacks a boolean verdict: " + content.asText());
        }
        return new Classification(relevant.asBoolean(), date(verdict.path("start_date")), date(verdict.path("end_date")));
    }

    private static JsonNode readJson(String text, String failure) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ContentParseException(failure, e);
        }
    }

    private static String unfence(String reply) {
        Matcher matcher = FENCED.matcher(reply);
        return matcher.find() ? matcher.group(1) : reply.trim();
    }

    private static LocalDate date(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(node.asText().trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
