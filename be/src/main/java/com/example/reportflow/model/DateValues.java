package com.example.reportflow.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient date parsing for record fields: ISO dates, ISO date-times (with or without
 * offset) and the corresponding {@code java.time} values.
 */
public final class DateValues {

    private DateValues() {
    }

    /**
     * Returns the calendar date for the given value, or empty when it is absent or cannot be parsed.
     */
    public static Optional<LocalDate> parse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof OffsetDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof ZonedDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant.atOffset(ZoneOffset.UTC).toLocalDate());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException ignored) {
            // not a plain date; try the date-time forms below
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // no offset; try a local date-time
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
