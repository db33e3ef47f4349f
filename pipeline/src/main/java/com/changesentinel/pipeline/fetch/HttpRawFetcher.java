package com.changesentinel.pipeline.fetch;

import com.changesentinel.core.error.BlockedException;
import com.changesentinel.core.error.FetchTimeoutException;
import com.changesentinel.core.error.HttpStatusException;
import com.changesentinel.core.error.NetworkException;

import org.jsoup.Jsoup;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

public class HttpRawFetcher implements RawFetcher {
    private final HttpClient httpClient;
    private final ChallengeDetector challengeDetector;
    private final String userAgent;
    private final String acceptLanguage;

    public HttpRawFetcher(HttpClient httpClient, ChallengeDetector challengeDetector, String userAgent, String acceptLanguage) {
        this.httpClient = httpClient;
        this.challengeDetector = challengeDetector;
        this.userAgent = userAgent;
        this.acceptLanguage = acceptLanguage;
    }

    @Override
    public String fetchRaw(URI uri, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout);
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }
        if (acceptLanguage != null && !acceptLanguage.isBlank()) {
            builder.header("Accept-Language", acceptLanguage);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchTimeoutException(uri.toString(), e);
        } catch (UnknownHostException e) {
            throw new NetworkException(uri.toString(), "DNS/unknown host while fetching " + uri + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new NetworkException(uri.toString(), "Fetch failure for " + uri + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(uri.toString(), "Interrupted while fetching " + uri, e);
        }

        String body = decode(uri, response);
        Optional<String> challenge = challengeDetector.detect(response.statusCode(), body);
        if (challenge.isPresent()) {
            throw new BlockedException(uri.toString(), challenge.get());
        }
        if (response.statusCode() >= 400) {
            throw new HttpStatusException(uri.toString(), response.statusCode());
        }
        return body;
    }

    private static String decode(URI uri, HttpResponse<byte[]> response) {
        byte[] bytes = response.body();
        if (bytes == null || bytes.length == 0) {
            return "";
        }
        String declared = headerCharset(response.headers().firstValue("Content-Type").orElse(null));
        try {
            // a null charset makes jsoup sniff the BOM and <meta charset>, defaulting to UTF-8
            Charset charset = Jsoup.parse(new ByteArrayInputStream(bytes), declared, uri.toString())
                    .charset();
            return new String(bytes, charset);
        } catch (IOException | RuntimeException e) {
            return new String(bytes, declared == null ? StandardCharsets.UTF_8 : Charset.forName(declared));
        }
    }

    private static String headerCharset(String contentType) {
        if (contentType == null) {
            return null;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").replace("'", "").trim();
                try {
                    return !name.isEmpty() && Charset.isSupported(name) ? name : null;
                } catch (IllegalCharsetNameException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
