package com.changesentinel.pipeline.notify;

import com.changesentinel.core.error.FetchException;
import com.changesentinel.core.model.Classification;
import com.changesentinel.core.model.NotificationEvent;
import com.changesentinel.core.model.NotificationKind;
import com.changesentinel.core.util.HtmlUtils;
import com.changesentinel.pipeline.fetch.Fetcher;
import com.changesentinel.pipeline.fetch.RetryPolicy;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ClassificationEnricher {
    private static final Logger LOGGER = Logger.getLogger(ClassificationEnricher.class.getName());
    private static final int MAX_CONTENT_CHARS = 4000;

    private final Classifier classifier;
    private final Fetcher fetcher;
    private final Duration fetchTimeout;

    private ClassificationEnricher(Classifier classifier, Fetcher fetcher, Duration fetchTimeout) {
        this.classifier = classifier;
        this.fetcher = fetcher;
        this.fetchTimeout = fetchTimeout;
    }

    public static ClassificationEnricher disabled() {
        return new ClassificationEnricher(null, null, null);
    }

    public static ClassificationEnricher enabled(Classifier classifier, Fetcher fetcher, Duration fetchTimeout) {
        return new ClassificationEnricher(classifier, fetcher, fetchTimeout);
    }

    public boolean isEnabled() {
        return classifier != null;
    }

    public Optional<NotificationEvent> enrich(NotificationEvent event) {
        if (classifier == null) {
            return Optional.of(event);
        }
        try {
            String content = contentFor(event);
            Classification classification = classifier.classify(event.title(), content);
            if (!classification.relevant()) {
                LOGGER.fine(() -> "Suppressed irrelevant " + event.kind() + " for task " + event.taskId() + ": " + event.title());
                return Optional.empty();
            }
            return Optional.of(event.withClassification(withDetails(event, classification, content)));
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Classification failed for task " + event.taskId() + "; delivering unenriched", ex);
            return Optional.of(event);
        }
    }

    private static Classification withDetails(NotificationEvent event, Classification classification, String content) {
        Classification detailed = classification;
        if (detailed.contact() == null) {
            detailed = detailed.withContact(NoticeDetails.contactGroup(content).orElse(null));
        }
        if (detailed.startDate() == null && event.kind() == NotificationKind.NEW_ITEM && content.contains(NoticeDetails.FROM_TODAY)) {
            detailed = detailed.withStartDate(NoticeDetails.parseDate(event.summary()).orElse(null));
        }
        String issue = detailed.dateRangeIssue();
        if (issue != null) {
            LOGGER.warning("Inconsistent dates for " + event.link() + " (task " + event.taskId() + "): " + issue
                    + ", start " + detailed.startDate() + ", end " + detailed.endDate());
        }
        return detailed;
    }

    private String contentFor(NotificationEvent event) {
        String fallback = event.summary() == null ? "" : event.summary();
        if (event.kind() != NotificationKind.NEW_ITEM || event.link() == null) {
            return fallback;
        }
        try {
            String html = fetcher.fetch(URI.create(event.link()), fetchTimeout, RetryPolicy.none());
            String text = HtmlUtils.visibleText(HtmlUtils.parse(html, event.link()));
            return text.length() > MAX_CONTENT_CHARS ? text.substring(0, MAX_CONTENT_CHARS) : text;
        } catch (FetchException | IllegalArgumentException ex) {
            LOGGER.fine(() -> "Detail fetch failed for " + event.link() + ": " + ex.getMessage());
            return fallback;
        }
    }
}
