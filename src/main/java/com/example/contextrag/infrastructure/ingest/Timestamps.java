package com.example.contextrag.infrastructure.ingest;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Lenient timestamp parsing for capture files. Scrapers emit ISO strings, epoch seconds
 * (sometimes fractional, e.g. Reddit's {@code created_utc}) or epoch millis.
 */
final class Timestamps {

    private static final double EPOCH_MILLIS_FLOOR = 1e12;

    private Timestamps() {
    }

    static Instant parse(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("timestamp is null");
        }
        if (value instanceof Number n) {
            return fromEpoch(n.doubleValue());
        }
        String s = String.valueOf(value).trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("timestamp is blank");
        }
        if (looksNumeric(s)) {
            return fromEpoch(Double.parseDouble(s));
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable timestamp '" + s + "'", e);
        }
    }

    private static Instant fromEpoch(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v) || v < 0) {
            throw new IllegalArgumentException("invalid epoch value " + v);
        }
        if (v >= EPOCH_MILLIS_FLOOR) {
            return Instant.ofEpochMilli((long) v);
        }
        long seconds = (long) v;
        long nanos = Math.round((v - seconds) * 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private static boolean looksNumeric(String s) {
        boolean digit = false;
        boolean dot = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') {
                digit = true;
            } else if (c == '.' && !dot) {
                dot = true;
            } else {
                return false;
            }
        }
        return digit;
    }
}
