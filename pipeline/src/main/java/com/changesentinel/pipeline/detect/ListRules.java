package com.changesentinel.pipeline.detect;

import java.util.List;

public record ListRules(
        String itemSelector,
        String linkSelector,
        String dateSelector,
        List<String> keywords,
        boolean fallbackToLinks
) {
    public ListRules {
        itemSelector = itemSelector == null || itemSelector.isBlank() ? "ul.list li" : itemSelector;
        linkSelector = linkSelector == null || linkSelector.isBlank() ? "a[href]" : linkSelector;
        dateSelector = dateSelector == null || dateSelector.isBlank() ? "span" : dateSelector;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static ListRules defaults() {
        return new ListRules(null, null, null, List.of(), true);
    }
}
