package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PostTimeParserTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-10T12:00:00Z"));

    @Test
    void parsesRelativeLabels() {
        PostTimeParser parser = parser("UTC");
        Instant now = clock.instant();

        assertThat(parser.parse("45s")).isEqualTo(now.minus(Duration.ofSeconds(45)));
        assertThat(parser.parse("3m")).isEqualTo(now.minus(Duration.ofMinutes(3)));
        assertThat(parser.parse("2h")).isEqualTo(now.minus(Duration.ofHours(2)));
    }

    @Test
    void parsesAbsoluteLabels() {
        PostTimeParser parser = parser("UTC");

        assertThat(parser.parse("25 Dec 2023")).isEqualTo(Instant.parse("2023-12-25T00:00:00Z"));
        assertThat(parser.parse("25 Dec 2023 · 15:30")).isEqualTo(Instant.parse("2023-12-25T15:30:00Z"));
        assertThat(parser.parse("Jan 23, 2024 · 10:30 AM UTC")).isEqualTo(Instant.parse("2024-01-23T10:30:00Z"));
        assertThat(parser.parse("Jan 23, 2024 · 10:30 pm UTC")).isEqualTo(Instant.parse("2024-01-23T22:30:00Z"));
        assertThat(parser.parse("Jan 23, 2024")).isEqualTo(Instant.parse("2024-01-23T00:00:00Z"));
    }

    @Test
    void monthDayLabelsRollBackToPreviousYearWhenInTheFuture() {
        PostTimeParser parser = parser("UTC");

        assertThat(parser.parse("Mar 1")).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(parser.parse("Dec 31")).isEqualTo(Instant.parse("2023-12-31T00:00:00Z"));
    }

    @Test
    void zonelessLabelsUseConfiguredTimezone() {
        PostTimeParser parser = parser("Asia/Shanghai");

        assertThat(parser.parse("25 Dec 2023 · 08:00")).isEqualTo(Instant.parse("2023-12-25T00:00:00Z"));
    }

    @Test
    void unknownLabelsYieldNull() {
        PostTimeParser parser = parser("UTC");

        assertThat(parser.parse("")).isNull();
        assertThat(parser.parse(null)).isNull();
        assertThat(parser.parse("yesterday-ish")).isNull();
    }

    private PostTimeParser parser(String zone) {
        WatchProperties properties = new WatchProperties();
        properties.getScheduler().setTimezone(zone);
        return new PostTimeParser(properties, clock);
    }
}
