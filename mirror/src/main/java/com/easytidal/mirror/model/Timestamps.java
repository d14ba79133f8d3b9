package com.easytidal.mirror.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Lenient ISO-8601 parsing for timestamps that come from the scheduler.
 *
 * Accepts instants ("2024-03-01T10:15:30Z"), offset date-times and local
 * date-times (taken as UTC). Anything else yields empty.
 */
public final class Timestamps {

    private Timestamps() {}

    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return Optional.of(odt.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
