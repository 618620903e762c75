package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.config.WatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the timestamps mirrors print next to a post: relative ({@code 5m}, {@code 2h}) or absolute
 * ({@code 25 Dec 2024}, {@code Jan 23, 2024 · 10:30 AM UTC}, {@code Jan 23}).
 */
@Component
public class PostTimeParser {
    private static final Logger log = LoggerFactory.getLogger(PostTimeParser.class);
    private static final Pattern RELATIVE = Pattern.compile("^(\\d+)\\s*([smhd])$", Pattern.CASE_INSENSITIVE);

    private enum Shape {
        ZONED,
        LOCAL_DATE_TIME,
        LOCAL_DATE,
        MONTH_DAY
    }

    private record Format(DateTimeFormatter formatter, Shape shape) {
    }

    private static final List<Format> FORMATS = List.of(
        format("d MMM yyyy · H:mm", Shape.LOCAL_DATE_TIME),
        format("d MMM yyyy · h:mm a", Shape.LOCAL_DATE_TIME),
        format("MMM d, yyyy · h:mm a z", Shape.ZONED),
        format("MMM d, yyyy · H:mm z", Shape.ZONED),
        format("yyyy-MM-dd HH:mm:ss z", Shape.ZONED),
        format("yyyy-MM-dd HH:mm:ss", Shape.LOCAL_DATE_TIME),
        format("d MMM yyyy", Shape.LOCAL_DATE),
        format("MMM d, yyyy", Shape.LOCAL_DATE),
        format("MMM d", Shape.MONTH_DAY)
    );

    private final Clock clock;
    private final ZoneId zone;

    public PostTimeParser(WatchProperties properties, Clock clock) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getScheduler().getTimezone());
    }

    /**
     * @return the instant the label denotes, or {@code null} when no known shape matches
     */
    public Instant parse(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String value = label.trim().replaceAll("\\s+", " ");
        Instant now = clock.instant();

        Matcher relative = RELATIVE.matcher(value);
        if (relative.matches()) {
            long amount = Long.parseLong(relative.group(1));
            switch (relative.group(2).toLowerCase(Locale.ROOT)) {
                case "s":
                    return now.minus(Duration.ofSeconds(amount));
                case "m":
                    return now.minus(Duration.ofMinutes(amount));
                case "h":
                    return now.minus(Duration.ofHours(amount));
                default:
                    return now.minus(Duration.ofDays(amount));
            }
        }

        for (Format format : FORMATS) {
            try {
                TemporalAccessor parsed = format.formatter().parse(value);
                return toInstant(parsed, format.shape(), now);
            } catch (DateTimeParseException e) {
                log.trace("Label '{}' does not match {}", value, format.formatter());
            }
        }
        log.debug("Unrecognized post time label '{}'", value);
        return null;
    }

    private Instant toInstant(TemporalAccessor parsed, Shape shape, Instant now) {
        switch (shape) {
            case ZONED:
                return ZonedDateTime.from(parsed).toInstant();
            case LOCAL_DATE_TIME:
                return LocalDateTime.from(parsed).atZone(zone).toInstant();
            case LOCAL_DATE:
                return LocalDate.from(parsed).atStartOfDay(zone).toInstant();
            default:
                MonthDay monthDay = MonthDay.from(parsed);
                int year = now.atZone(zone).getYear();
                Instant candidate = monthDay.atYear(year).atStartOfDay(zone).toInstant();
                if (candidate.isAfter(now)) {
                    candidate = monthDay.atYear(year - 1).atStartOfDay(zone).toInstant();
                }
                return candidate;
        }
    }

    private static Format format(String pattern, Shape shape) {
        DateTimeFormatter formatter = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
        return new Format(formatter, shape);
    }
}
