package com.changesentinel.core.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private HtmlUtils() {
    }

    public static Document parse(String html, String baseUri) {
        return Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);
    }

    public static Optional<String> extractTitle(Document document) {
        String title = collapseWhitespace(document.title());
        return title.isEmpty() ? Optional.empty() : Optional.of(title);
    }

    public static String visibleText(Document document) {
        Element body = document.body();
        return body == null ? "" : collapseWhitespace(body.text());
    }

    public static boolean isFollowableLink(String link) {
        String lowered = link.trim().toLowerCase(Locale.ROOT);
        return !lowered.isEmpty()
                && !lowered.startsWith("#")
                && !lowered.startsWith("mailto:")
                && !lowered.startsWith("javascript:");
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String abbreviate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars).trim() + "...";
    }
}
