package com.changesentinel.pipeline.detect;

import com.changesentinel.core.error.ConfigException;
import com.changesentinel.core.util.HtmlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class ContentNormalizer {
    private final NormalizationRules rules;
    private final List<Pattern> stripPatterns;

    public ContentNormalizer(NormalizationRules rules) {
        this.rules = rules;
        for (String selector : rules.removeSelectors()) {
            try {
                QueryParser.parse(selector);
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                throw new ConfigException("Invalid remove selector '" + selector + "': " + e.getMessage());
            }
        }
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : rules.stripPatterns()) {
            try {
                compiled.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                throw new ConfigException("Invalid strip pattern '" + pattern + "': " + e.getDescription());
            }
        }
        this.stripPatterns = List.copyOf(compiled);
    }

    public String normalize(String html) {
        return normalize(HtmlUtils.parse(html, ""));
    }

    public String normalize(Document document) {
        Document cleaned = document.clone();
        for (String selector : rules.removeSelectors()) {
            cleaned.select(selector).remove();
        }
        String text = rules.textOnly() ? HtmlUtils.visibleText(cleaned) : cleaned.body().html();
        for (Pattern pattern : stripPatterns) {
            text = pattern.matcher(text).replaceAll("");
        }
        return HtmlUtils.collapseWhitespace(text);
    }
}
