package org.neuralchilli.decision.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses relative offsets such as {@code "1 day"}, {@code "3 months"} or
 * {@code "2 hours 30 minutes"} and applies them to a fixed instant.
 */
public final class DurationParser {

    private static final Pattern PART = Pattern.compile(
            "\\s*(-?\\d+)\\s*(years?|yr|months?|mo|weeks?|w|days?|d|hours?|h|minutes?|min|m|seconds?|sec|s)\\s*",
            Pattern.CASE_INSENSITIVE
    );

    private DurationParser() {
    }

    /**
     * Instant reached by adding {@code offset} to {@code now}. Blank offsets return {@code now}.
     * Months and years are calendar units (UTC).
     */
    public static Instant fromNow(String offset, Instant now) {
        if (offset == null || offset.isBlank()) {
            return now;
        }

        ZonedDateTime result = now.atZone(ZoneOffset.UTC);
        Matcher matcher = PART.matcher(offset);
        int position = 0;
        while (position < offset.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new IllegalArgumentException("Invalid time offset: '" + offset + "'");
            }
            long amount = Long.parseLong(matcher.group(1));
            result = plus(result, amount, matcher.group(2).toLowerCase());
            position = matcher.end();
        }
        return result.toInstant();
    }

    public static Duration toDuration(String offset) {
        Instant epoch = Instant.EPOCH;
        return Duration.between(epoch, fromNow(offset, epoch));
    }

    private static ZonedDateTime plus(ZonedDateTime time, long amount, String unit) {
        if (unit.startsWith("y")) {
            return time.plusYears(amount);
        }
        if (unit.startsWith("mo")) {
            return time.plusMonths(amount);
        }
        if (unit.startsWith("w")) {
            return time.plusWeeks(amount);
        }
        if (unit.startsWith("d")) {
            return time.plusDays(amount);
        }
        if (unit.startsWith("h")) {
            return time.plusHours(amount);
        }
        if (unit.startsWith("m")) {
            return time.plusMinutes(amount);
        }
        return time.plusSeconds(amount);
    }
}
