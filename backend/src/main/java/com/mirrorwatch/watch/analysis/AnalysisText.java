package com.mirrorwatch.watch.analysis;

import com.mirrorwatch.watch.model.Item;

import java.util.regex.Pattern;

/**
 * Text sent for analysis: the post without media and link URLs, followed by the quoted post if any.
 */
public final class AnalysisText {
    private static final Pattern URL = Pattern.compile("https?://\\S+");

    private AnalysisText() {
    }

    public static String prepare(Item item) {
        if (item == null) {
            return "";
        }
        String text = item.content() == null ? "" : item.content();
        for (String media : item.media()) {
            text = text.replace(media, "");
        }
        text = URL.matcher(text).replaceAll("").strip();
        if (text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text);
        if (item.quote() && item.quoteText() != null && !item.quoteText().isBlank()) {
            out.append("\n\nQuoted:\n").append(item.quoteText().strip());
            if (item.quoteAuthor() != null && !item.quoteAuthor().isBlank()) {
                out.append("\nAuthor: ").append(item.quoteAuthor().strip());
            }
        }
        return out.toString();
    }
}
