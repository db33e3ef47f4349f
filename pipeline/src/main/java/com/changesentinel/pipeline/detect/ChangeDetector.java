package com.changesentinel.pipeline.detect;

import com.changesentinel.core.error.ContentParseException;
import com.changesentinel.core.model.CheckOutcome;
import com.changesentinel.core.model.Fingerprint;
import com.changesentinel.core.model.ListItem;
import com.changesentinel.core.model.MonitorTask;
import com.changesentinel.core.util.HashingUtils;
import com.changesentinel.core.util.HtmlUtils;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.stream.Collectors;

public class ChangeDetector {
    static final int SUMMARY_CHARS = 200;
    static final String UNTITLED = "(untitled)";

    private static final String EMPTY_LISTING_DIGEST = HashingUtils.sha256("");

    private final ContentNormalizer normalizer;
    private final ItemExtractor itemExtractor;

    public ChangeDetector(ContentNormalizer normalizer, ItemExtractor itemExtractor) {
        this.normalizer = normalizer;
        this.itemExtractor = itemExtractor;
    }

    public Detection detect(MonitorTask task, String content) {
        Document document = HtmlUtils.parse(content, task.url());
        String title = HtmlUtils.extractTitle(document).orElse(UNTITLED);
        Fingerprint next = new Fingerprint(HashingUtils.sha256(normalizer.normalize(document)), summarize(document));
        return new Detection(classify(task.fingerprint(), next), next, title);
    }

    public ItemDetection detectItems(MonitorTask task, String content) {
        Document document = HtmlUtils.parse(content, task.url());
        List<ListItem> items;
        try {
            items = itemExtractor.extract(document);
        } catch (RuntimeException e) {
            throw new ContentParseException("Unable to enumerate items at " + task.url() + ": " + e.getMessage(), e);
        }
        String ids = items.stream().map(ListItem::id).collect(Collectors.joining("\n"));
        String digest = HashingUtils.sha256(ids);
        Fingerprint previous = task.fingerprint();
        if (items.isEmpty() && previous != null && !EMPTY_LISTING_DIGEST.equals(previous.digest())) {
            throw new ContentParseException("No items found at " + task.url() + " where items were listed before");
        }
        String summary = items.isEmpty() ? "0 items" : items.size() + " items, latest: " + items.get(0).title();
        Fingerprint next = new Fingerprint(digest, summary);
        String title = HtmlUtils.extractTitle(document).orElse(UNTITLED);
        return new ItemDetection(new Detection(classify(previous, next), next, title), items);
    }

    private static CheckOutcome classify(Fingerprint previous, Fingerprint next) {
        if (previous == null) {
            return CheckOutcome.BASELINE;
        }
        return next.sameContentAs(previous) ? CheckOutcome.UNCHANGED : CheckOutcome.CHANGED;
    }

    private static String summarize(Document document) {
        String title = HtmlUtils.extractTitle(document).orElse(UNTITLED);
        String text = HtmlUtils.abbreviate(HtmlUtils.visibleText(document), SUMMARY_CHARS);
        return text.isEmpty() ? title : title + ": " + text;
    }
}
