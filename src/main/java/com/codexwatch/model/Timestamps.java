package com.codexwatch.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 handling shared by the GitHub client and the checkpoint record.
 */
public final class Timestamps {

    private Timestamps() {}

    /**
     * Parses an ISO-8601 date-time. Text with an offset or {@code Z} is
     * converted to UTC; text without one is taken to be UTC already.
     *
     * @throws DateTimeParseException if the text is not an ISO-8601 date-time
     */
    public static Instant parseUtc(String text) {
        String trimmed = text.strip();
        try {
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                    .toInstant(ZoneOffset.UTC);
        }
    }

    /**
     * {@code 2026-02-17T09:00:00Z} style.
     */
    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
