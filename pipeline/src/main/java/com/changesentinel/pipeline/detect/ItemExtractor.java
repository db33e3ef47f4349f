package com.changesentinel.pipeline.detect;

import com.changesentinel.core.error.ConfigException;
import com.changesentinel.core.model.ListItem;
import com.changesentinel.core.util.HtmlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ItemExtractor {
    private final ListRules rules;

    public ItemExtractor(ListRules rules) {
        this.rules = rules;
        validate(rules.itemSelector());
        validate(rules.linkSelector());
        validate(rules.dateSelector());
    }

    public List<ListItem> extract(String html, String baseUrl) {
        return extract(HtmlUtils.parse(html, baseUrl));
    }

    public List<ListItem> extract(Document document) {
        Map<String, ListItem> items = new LinkedHashMap<>();
        Elements rows = document.select(rules.itemSelector());
        for (Element row : rows) {
            Element link = row.is(rules.linkSelector()) ? row : row.selectFirst(rules.linkSelector());
            if (link == null) {
                continue;
            }
            Element date = row.selectFirst(rules.dateSelector());
            String posted = date == null ? null : blankToNull(HtmlUtils.collapseWhitespace(date.text()));
            add(items, link, posted);
        }
        if (rows.isEmpty() && rules.fallbackToLinks()) {
            for (Element link : document.select("a[href]")) {
                add(items, link, null);
            }
        }
        return new ArrayList<>(items.values());
    }

    private void add(Map<String, ListItem> items, Element link, String posted) {
        String href = link.attr("href").trim();
        String title = HtmlUtils.collapseWhitespace(link.text());
        if (title.isEmpty() || !HtmlUtils.isFollowableLink(href) || !matchesKeywords(title)) {
            return;
        }
        String absolute = link.absUrl("href");
        String id = absolute.isEmpty() ? href : absolute;
        items.putIfAbsent(id, new ListItem(id, title, id, posted));
    }

    private boolean matchesKeywords(String title) {
        if (rules.keywords().isEmpty()) {
            return true;
        }
        return rules.keywords().stream().anyMatch(title::contains);
    }

    private static String blankToNull(String value) {
        return value.isEmpty() ? null : value;
    }

    private static void validate(String selector) {
        try {
            QueryParser.parse(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new ConfigException("Invalid list selector '" + selector + "': " + e.getMessage());
        }
    }
}
