package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.Item;
import com.mirrorwatch.watch.model.TrackedAccount;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class TimelineParser {
    private static final Logger log = LoggerFactory.getLogger(TimelineParser.class);
    private static final String CANONICAL_HOST = "https://twitter.com";

    private final PostTimeParser timeParser;
    private final Clock clock;
    private final String screenshotBaseUrl;

    public TimelineParser(PostTimeParser timeParser, WatchProperties properties, Clock clock) {
        this.timeParser = timeParser;
        this.clock = clock;
        this.screenshotBaseUrl = stripTrailingSlash(properties.getRenderer().getScreenshotBaseUrl());
    }

    public ParsedTimeline parse(String html, String pageUrl, TrackedAccount account) {
        if (html == null || html.isBlank()) {
            return new ParsedTimeline(0, List.of());
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        Elements entries = document.select(".timeline-item");
        Instant capturedAt = clock.instant();
        List<Item> items = new ArrayList<>();
        for (Element entry : entries) {
            Item item = parseEntry(entry, account, capturedAt);
            if (item != null) {
                items.add(item);
            }
        }
        return new ParsedTimeline(entries.size(), items);
    }

    private Item parseEntry(Element entry, TrackedAccount account, Instant capturedAt) {
        Element link = entry.selectFirst(".tweet-link");
        if (link == null) {
            return null;
        }
        String href = link.attr("href");
        String id = extractId(href);
        if (id.isEmpty()) {
            log.debug("Skipping timeline entry without id for {} (href={})", account.handle(), href);
            return null;
        }

        Element content = entry.selectFirst(".tweet-content");
        String text = content == null ? "" : content.text();

        Element date = entry.selectFirst(".tweet-date");
        String label = date == null ? "" : date.text();
        Element dateLink = date == null ? null : date.selectFirst("a[title]");
        String absoluteLabel = dateLink == null ? "" : dateLink.attr("title");
        Instant publishedAt = timeParser.parse(absoluteLabel);
        if (publishedAt == null) {
            publishedAt = timeParser.parse(label);
        }

        boolean retweet = entry.selectFirst(".retweet-header") != null;
        Element retweetAuthorElement = entry.selectFirst(".retweet-author");
        String retweetAuthor = retweetAuthorElement == null ? null : retweetAuthorElement.text();

        Element quote = entry.selectFirst(".quote");
        String quoteText = null;
        String quoteAuthor = null;
        if (quote != null) {
            Element quoteTextElement = quote.selectFirst(".quote-text");
            quoteText = quoteTextElement == null ? null : quoteTextElement.text();
            Element quoteAuthorElement = quote.selectFirst(".fullname");
            quoteAuthor = quoteAuthorElement == null ? null : quoteAuthorElement.text();
        }

        Set<String> media = new LinkedHashSet<>();
        for (Element image : entry.select(".tweet-media[src], .tweet-media img[src], .attachments img[src]")) {
            String src = image.absUrl("src");
            media.add(src.isEmpty() ? image.attr("src") : src);
        }

        String path = stripFragmentAndQuery(href);
        String url = path.startsWith("http") ? path : CANONICAL_HOST + path;
        String screenshotRef = screenshotBaseUrl.isEmpty() ? null : screenshotBaseUrl + "/images/" + id + ".png";

        return new Item(
            id,
            account.handle(),
            account.alias(),
            text,
            url,
            label,
            publishedAt,
            capturedAt,
            screenshotRef,
            entry.selectFirst(".pinned") != null,
            retweet,
            retweetAuthor == null || retweetAuthor.isBlank() ? null : retweetAuthor,
            quote != null,
            quoteText,
            quoteAuthor,
            new ArrayList<>(media)
        );
    }

    static String extractId(String href) {
        if (href == null || href.isBlank()) {
            return "";
        }
        String path = stripFragmentAndQuery(href.trim());
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static String stripFragmentAndQuery(String href) {
        String out = href;
        int hash = out.indexOf('#');
        if (hash >= 0) {
            out = out.substring(0, hash);
        }
        int query = out.indexOf('?');
        if (query >= 0) {
            out = out.substring(0, query);
        }
        return out;
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String out = value.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
