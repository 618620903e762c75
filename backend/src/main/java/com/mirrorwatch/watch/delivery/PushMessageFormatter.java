package com.mirrorwatch.watch.delivery;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.EnrichedItem;
import com.mirrorwatch.watch.model.Item;
import com.mirrorwatch.watch.model.PushPayload;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Markdown title and body of the notification for one item.
 */
@Component
public class PushMessageFormatter {
    private static final String ANALYSIS_UNAVAILABLE = "_Analysis unavailable; original text below._";

    private final DateTimeFormatter timestampFormat;

    public PushMessageFormatter(WatchProperties properties) {
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.of(properties.getScheduler().getTimezone()));
    }

    public PushPayload format(EnrichedItem enriched) {
        Item item = enriched.item();
        return new PushPayload(item.id(), item.accountHandle(), title(enriched), body(enriched));
    }

    String title(EnrichedItem enriched) {
        Item item = enriched.item();
        List<String> parts = new ArrayList<>();
        if (item.retweet()) {
            parts.add("🔄 [Retweet]");
        } else if (item.quote()) {
            parts.add("💬 [Quote]");
        }
        parts.add("【" + item.accountAlias() + "】");
        Analysis analysis = enriched.analysis();
        if (enriched.analysisAvailable() && analysis != null && !isBlank(analysis.summary())) {
            parts.add(firstLine(analysis.summary()));
        } else if (item.hasText()) {
            parts.add(abbreviate(item.content(), 60));
        }
        return String.join(" ", parts);
    }

    String body(EnrichedItem enriched) {
        Item item = enriched.item();
        StringBuilder out = new StringBuilder();

        out.append("### Analysis\n\n");
        Analysis analysis = enriched.analysis();
        if (enriched.analysisAvailable() && analysis != null) {
            appendField(out, "Translation", analysis.translation());
            appendField(out, "Summary", analysis.summary());
            appendField(out, "Tags", analysis.tags());
            appendField(out, "Category", analysis.category());
        } else {
            out.append(ANALYSIS_UNAVAILABLE).append("\n\n");
        }

        out.append("### Details\n\n");
        out.append("- **Posted**: ").append(isBlank(item.publishedLabel()) ? "unknown" : item.publishedLabel()).append('\n');
        out.append("- **Date**: ").append(item.publishedAt() == null ? "-" : timestampFormat.format(item.publishedAt())).append('\n');
        out.append("- **Link**: [open](").append(isBlank(item.url()) ? "#" : item.url()).append(")\n");
        out.append("- **Id**: `").append(item.id()).append("`\n");

        if (item.retweet() && !isBlank(item.retweetAuthor())) {
            out.append("\n### Retweeted from\n\n**@").append(item.retweetAuthor()).append("**\n");
        } else if (item.quote() && !isBlank(item.quoteText())) {
            out.append("\n### Quoted post\n\n**@")
                .append(isBlank(item.quoteAuthor()) ? "unknown" : item.quoteAuthor())
                .append("**:\n")
                .append(item.quoteText())
                .append('\n');
        }

        out.append("\n### Original\n\n").append(item.hasText() ? item.content() : "(no text)").append('\n');

        if (!item.media().isEmpty()) {
            out.append("\n### Media\n\n");
            for (String media : item.media()) {
                out.append("![image](").append(media).append(")\n");
            }
        }
        if (!isBlank(item.screenshotRef())) {
            out.append("\n### Screenshot\n\n![screenshot](").append(item.screenshotRef()).append(")\n");
        }
        return out.toString();
    }

    private static void appendField(StringBuilder out, String label, String value) {
        if (isBlank(value)) {
            return;
        }
        out.append("**").append(label).append("**\n\n").append(value.strip()).append("\n\n");
    }

    private static String firstLine(String value) {
        String trimmed = value.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }

    private static String abbreviate(String value, int max) {
        String flat = value.strip().replaceAll("\\s+", " ");
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
