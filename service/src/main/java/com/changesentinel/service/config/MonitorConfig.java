package com.changesentinel.service.config;

import com.changesentinel.core.error.ConfigException;
import com.changesentinel.core.model.MonitorMode;
import com.changesentinel.pipeline.api.DedupScope;
import com.changesentinel.pipeline.detect.ListRules;
import com.changesentinel.pipeline.detect.NormalizationRules;
import com.changesentinel.pipeline.fetch.ChallengeDetector;
import com.changesentinel.pipeline.fetch.RetryPolicy;
import com.changesentinel.service.store.JsonlEventStore;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record MonitorConfig(
        Duration minInterval,
        Duration tickInterval,
        Integer maxConcurrency,
        Integer degradedThreshold,
        Duration fetchTimeout,
        RetrySettings retry,
        String userAgent,
        String acceptLanguage,
        List<Integer> blockedStatuses,
        List<String> blockedMarkers,
        NormalizationSettings normalization,
        ListSettings list,
        DedupScope dedupScope,
        String zone,
        TransportSettings transport,
        ClassifierSettings classifier,
        RendererSettings renderer,
        JournalSettings journal,
        List<SeedTask> seedTasks
) {
    static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";
    static final String DEFAULT_ACCEPT_LANGUAGE = "zh-CN,zh;q=0.9,en;q=0.8";

    public MonitorConfig {
        minInterval = minInterval == null ? Duration.ofSeconds(60) : minInterval;
        tickInterval = tickInterval == null ? Duration.ofSeconds(1) : tickInterval;
        maxConcurrency = maxConcurrency == null ? 4 : maxConcurrency;
        degradedThreshold = degradedThreshold == null ? 3 : degradedThreshold;
        fetchTimeout = fetchTimeout == null ? Duration.ofSeconds(20) : fetchTimeout;
        retry = retry == null ? new RetrySettings(null, null) : retry;
        userAgent = userAgent == null ? DEFAULT_USER_AGENT : userAgent;
        acceptLanguage = acceptLanguage == null ? DEFAULT_ACCEPT_LANGUAGE : acceptLanguage;
        blockedStatuses = blockedStatuses == null ? List.of(403, 429) : List.copyOf(blockedStatuses);
        blockedMarkers = blockedMarkers == null ? List.of("dynamic_challenge") : List.copyOf(blockedMarkers);
        normalization = normalization == null ? new NormalizationSettings(null, null, null) : normalization;
        list = list == null ? new ListSettings(null, null, null, null, null) : list;
        dedupScope = dedupScope == null ? DedupScope.GLOBAL : dedupScope;
        transport = transport == null ? new TransportSettings(null, null, null) : transport;
        classifier = classifier == null ? new ClassifierSettings(false, null, null, null, null) : classifier;
        renderer = renderer == null ? new RendererSettings(false, null, null) : renderer;
        journal = journal == null ? new JournalSettings(null, null) : journal;
        seedTasks = seedTasks == null ? List.of() : List.copyOf(seedTasks);
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null);
    }

    public MonitorConfig validate() {
        requirePositive("minInterval", minInterval);
        requirePositive("tickInterval", tickInterval);
        requirePositive("fetchTimeout", fetchTimeout);
        if (maxConcurrency < 1) {
            throw new ConfigException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        if (degradedThreshold < 0) {
            throw new ConfigException("degradedThreshold must not be negative, got " + degradedThreshold);
        }
        if (retry.maxAttempts() < 1) {
            throw new ConfigException("retry.maxAttempts must be at least 1, got " + retry.maxAttempts());
        }
        for (Duration step : retry.backoff()) {
            if (step.isNegative()) {
                throw new ConfigException("retry.backoff entries must not be negative, got " + step);
            }
        }
        if (!"log".equals(transport.type()) && !"webhook".equals(transport.type())) {
            throw new ConfigException("Unsupported transport type: " + transport.type());
        }
        if ("webhook".equals(transport.type()) && (transport.webhookUrl() == null || transport.webhookUrl().isBlank())) {
            throw new ConfigException("transport.webhookUrl is required for the webhook transport");
        }
        if (classifier.enabled() && (classifier.apiKey() == null || classifier.apiKey().isBlank())) {
            throw new ConfigException("classifier.apiKey (or CLASSIFIER_API_KEY) is required when the classifier is enabled");
        }
        if (renderer.enabled() && renderer.command().isEmpty()) {
            throw new ConfigException("renderer.command is required when the renderer is enabled");
        }
        if (journal.maxBytes() < 1 || journal.keepSegments() < 0) {
            throw new ConfigException("journal.maxBytes must be positive and journal.keepSegments not negative");
        }
        zoneId();
        return this;
    }

    public ZoneId zoneId() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (RuntimeException e) {
            throw new ConfigException("Invalid zone '" + zone + "': " + e.getMessage());
        }
    }

    public ChallengeDetector challengeDetector() {
        return new ChallengeDetector(Set.copyOf(blockedStatuses), blockedMarkers);
    }

    public MonitorConfig withClassifierApiKey(String apiKey) {
        ClassifierSettings updated = new ClassifierSettings(
                classifier.enabled(), classifier.baseUrl(), classifier.model(), apiKey, classifier.timeout());
        return new MonitorConfig(minInterval, tickInterval, maxConcurrency, degradedThreshold, fetchTimeout, retry,
                userAgent, acceptLanguage, blockedStatuses, blockedMarkers, normalization, list, dedupScope, zone,
                transport, updated, renderer, journal, seedTasks);
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new ConfigException(name + " must be positive, got " + value);
        }
    }

    public record RetrySettings(Integer maxAttempts, List<Duration> backoff) {
        public RetrySettings {
            maxAttempts = maxAttempts == null ? 3 : maxAttempts;
            backoff = backoff == null ? List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)) : List.copyOf(backoff);
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, backoff);
        }
    }

    public record NormalizationSettings(List<String> removeSelectors, List<String> stripPatterns, Boolean textOnly) {
        public NormalizationRules toRules() {
            return new NormalizationRules(removeSelectors, stripPatterns, textOnly == null || textOnly);
        }
    }

    public record ListSettings(
            String itemSelector,
            String linkSelector,
            String dateSelector,
            List<String> keywords,
            Boolean fallbackToLinks
    ) {
        public ListRules toRules() {
            return new ListRules(itemSelector, linkSelector, dateSelector, keywords,
                    fallbackToLinks == null || fallbackToLinks);
        }
    }

    public record TransportSettings(String type, String webhookUrl, Duration timeout) {
        public TransportSettings {
            type = type == null || type.isBlank() ? "log" : type.trim().toLowerCase(Locale.ROOT);
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        }
    }

    public record ClassifierSettings(boolean enabled, String baseUrl, String model, String apiKey, Duration timeout) {
        public ClassifierSettings {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.deepseek.com" : baseUrl;
            model = model == null || model.isBlank() ? "deepseek-chat" : model;
            timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        }
    }

    public record RendererSettings(boolean enabled, List<String> command, Duration timeout) {
        public RendererSettings {
            command = command == null ? List.of() : List.copyOf(command);
            timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
        }
    }

    public record JournalSettings(Long maxBytes, Integer keepSegments) {
        public JournalSettings {
            maxBytes = maxBytes == null ? JsonlEventStore.DEFAULT_MAX_BYTES : maxBytes;
            keepSegments = keepSegments == null ? JsonlEventStore.DEFAULT_KEEP_SEGMENTS : keepSegments;
        }
    }

    public record SeedTask(String url, MonitorMode mode, Duration interval, String destination) {
        public SeedTask {
            mode = mode == null ? MonitorMode.PAGE : mode;
        }
    }
}
