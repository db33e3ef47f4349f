package com.changesentinel.pipeline.detect;

import java.util.List;

public record NormalizationRules(List<String> removeSelectors, List<String> stripPatterns, boolean textOnly) {
    public static final List<String> DEFAULT_REMOVE_SELECTORS =
            List.of("script", "style", "noscript", "template", "iframe", "svg");

    public NormalizationRules {
        removeSelectors = removeSelectors == null ? DEFAULT_REMOVE_SELECTORS : List.copyOf(removeSelectors);
        stripPatterns = stripPatterns == null ? List.of() : List.copyOf(stripPatterns);
    }

    public static NormalizationRules defaults() {
        return new NormalizationRules(DEFAULT_REMOVE_SELECTORS, List.of(), true);
    }
}
