package com.flowb.social.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Hour-of-day window arithmetic for quiet hours and daily rate caps.
 */
public final class QuietHours {

    private QuietHours() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Whether {@code hour} falls in {@code [start, end)}. A start after the end means the
     * window spans midnight, so 22..8 covers 22, 23 and 0 through 7. Equal bounds are an
     * empty window.
     */
    public static boolean isQuietHour(int hour, int start, int end) {
        if (start == end) {
            return false;
        }
        if (start < end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }

    public static boolean isQuietAt(Instant now, ZoneId zone, int start, int end) {
        int hour = now.atZone(zone).getHour();
        return isQuietHour(hour, start, end);
    }

    /**
     * Parse a zone id, falling back when it is blank or unknown.
     */
    public static ZoneId zoneOrDefault(String timezone, ZoneId fallback) {
        if (timezone == null || timezone.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            return fallback;
        }
    }

    public static Instant startOfDay(Instant now, ZoneId zone) {
        LocalDate today = now.atZone(zone).toLocalDate();
        return today.atStartOfDay(zone).toInstant();
    }
}
