package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.Item;
import com.mirrorwatch.watch.model.TrackedAccount;
import com.mirrorwatch.watch.support.MutableClock;
import com.mirrorwatch.watch.support.TimelineHtml;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineParserTest {
    private static final TrackedAccount ALICE = TrackedAccount.of("Alice A.", "alice");

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));

    @Test
    void parsesTimelineEntriesInPageOrder() {
        TimelineParser parser = parser("");

        ParsedTimeline timeline = parser.parse(TimelineHtml.ALICE_TIMELINE, "https://mirror.example/alice", ALICE);

        assertThat(timeline.entryCount()).isEqualTo(5);
        List<Item> items = timeline.items();
        assertThat(items).extracting(Item::id).containsExactly("100", "123", "122", "121");

        Item pinned = items.get(0);
        assertThat(pinned.pinned()).isTrue();
        assertThat(pinned.publishedAt()).isEqualTo(Instant.parse("2024-01-23T10:30:00Z"));
        assertThat(pinned.url()).isEqualTo("https://twitter.com/alice/status/100");
        assertThat(pinned.accountAlias()).isEqualTo("Alice A.");
        assertThat(pinned.screenshotRef()).isNull();

        Item fresh = items.get(1);
        assertThat(fresh.content()).isEqualTo("Fresh post https://t.co/xyz");
        assertThat(fresh.publishedLabel()).isEqualTo("2h");
        assertThat(fresh.publishedAt()).isEqualTo(clock.instant().minus(Duration.ofHours(2)));
        assertThat(fresh.capturedAt()).isEqualTo(clock.instant());
        assertThat(fresh.media()).containsExactly("https://mirror.example/pic/media%2Fabc.jpg");

        Item retweet = items.get(2);
        assertThat(retweet.retweet()).isTrue();
        assertThat(retweet.retweetAuthor()).isEqualTo("bob");
        assertThat(retweet.url()).isEqualTo("https://twitter.com/bob/status/122");

        Item quote = items.get(3);
        assertThat(quote.quote()).isTrue();
        assertThat(quote.quoteText()).isEqualTo("Original quoted words");
        assertThat(quote.quoteAuthor()).isEqualTo("Carol");
    }

    @Test
    void addsScreenshotReferenceWhenConfigured() {
        TimelineParser parser = parser("https://shots.example/");

        Item first = parser.parse(TimelineHtml.ALICE_TIMELINE, "https://mirror.example/alice", ALICE).items().get(0);

        assertThat(first.screenshotRef()).isEqualTo("https://shots.example/images/100.png");
    }

    @Test
    void emptyPageHasNoEntries() {
        ParsedTimeline timeline = parser("").parse(TimelineHtml.EMPTY_TIMELINE, "https://mirror.example/alice", ALICE);

        assertThat(timeline.entryCount()).isZero();
        assertThat(timeline.items()).isEmpty();
    }

    @Test
    void extractsIdFromStatusLinks() {
        assertThat(TimelineParser.extractId("/alice/status/1750000000000000000#m")).isEqualTo("1750000000000000000");
        assertThat(TimelineParser.extractId("/alice/status/42?s=20")).isEqualTo("42");
        assertThat(TimelineParser.extractId("/alice/status/42/")).isEqualTo("42");
        assertThat(TimelineParser.extractId("")).isEmpty();
    }

    private TimelineParser parser(String screenshotBase) {
        WatchProperties properties = new WatchProperties();
        properties.getRenderer().setScreenshotBaseUrl(screenshotBase);
        return new TimelineParser(new PostTimeParser(properties, clock), properties, clock);
    }
}
