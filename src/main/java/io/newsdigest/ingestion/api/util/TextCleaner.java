package io.newsdigest.ingestion.api.util;

import org.jsoup.Jsoup;

public final class TextCleaner {

    private TextCleaner() {
    }

    /**
     * Strips markup, decodes entities and collapses whitespace.
     */
    public static String clean(String text) {
        if (text == null || text.isBlank()) return "";

        String plain = text.indexOf('<') >= 0 || text.indexOf('&') >= 0
                ? Jsoup.parse(text).text()
                : text;

        return collapseWhitespace(plain);
    }

    public static String collapseWhitespace(String text) {
        if (text == null) return "";

        return text
                .replace('\u00a0', ' ')
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Cuts at the last word boundary before {@code maxChars} and appends an ellipsis.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null) return "";
        if (maxChars <= 0 || text.length() <= maxChars) return text;

        int cut = text.lastIndexOf(' ', maxChars);
        if (cut < maxChars / 2) {
            cut = maxChars;
        }
        return text.substring(0, cut).stripTrailing() + "...";
    }
}
