package com.ofx.tagtree.aggregate;

import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses OFX date-time values: {@code YYYYMMDD[HHMM[SS[.XXX]]][[gmt offset[:tz name]]]}.
 *
 * <p>Missing time fields default to zero and a missing offset means UTC. Offsets are whole hours
 * with optional minutes written after a dot, e.g. {@code [-5:EST]} or {@code [+5.30:IST]}.
 */
public final class OfxDateTimeParser {

    private static final Pattern DATE_TIME =
            Pattern.compile(
                    "(\\d{4})(\\d{2})(\\d{2})"
                            + "(?:(\\d{2})(\\d{2})(?:(\\d{2})(?:\\.(\\d{3}))?)?)?"
                            + "(?:\\[([-+]?\\d{1,2})(?:\\.(\\d{2}))?(?::([A-Za-z]+))?\\])?");

    private OfxDateTimeParser() {}

    public static OffsetDateTime parse(String text) {
        String trimmed = text == null ? "" : text.trim();
        Matcher matcher = DATE_TIME.matcher(trimmed);
        if (!matcher.matches()) {
            throw new DateTimeException("Invalid OFX date-time: '" + text + "'");
        }
        int year = Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(2));
        int day = Integer.parseInt(matcher.group(3));
        int hour = group(matcher, 4);
        int minute = group(matcher, 5);
        int second = group(matcher, 6);
        int millis = group(matcher, 7);
        return OffsetDateTime.of(year, month, day, hour, minute, second, millis * 1_000_000, offset(matcher));
    }

    private static ZoneOffset offset(Matcher matcher) {
        String hours = matcher.group(8);
        if (hours == null) {
            return ZoneOffset.UTC;
        }
        int offsetHours = Integer.parseInt(hours.startsWith("+") ? hours.substring(1) : hours);
        int offsetMinutes = group(matcher, 9);
        if (hours.startsWith("-")) {
            offsetMinutes = -offsetMinutes;
        }
        return ZoneOffset.ofHoursMinutes(offsetHours, offsetMinutes);
    }

    private static int group(Matcher matcher, int index) {
        String value = matcher.group(index);
        return value == null ? 0 : Integer.parseInt(value);
    }
}
