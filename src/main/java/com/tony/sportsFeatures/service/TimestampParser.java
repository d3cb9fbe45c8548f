package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.exception.MalformedTimestampException;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Lecture des dates des lignes brutes.
 * Formats acceptés : 2024-01-15, 2024-01-15T19:30[:00], 2024-01-15 19:30[:00], avec offset optionnel.
 * Une date avec offset est ramenée en UTC pour que l'ordre chronologique reste celui des instants.
 */
@Component
public class TimestampParser {

    private static final DateTimeFormatter FLEXIBLE_ISO = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd")
            .optionalStart().appendLiteral('T').appendPattern("HH:mm")
                .optionalStart().appendPattern(":ss").optionalEnd()
                .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalEnd()
            .optionalStart().appendLiteral(' ').appendPattern("HH:mm")
                .optionalStart().appendPattern(":ss").optionalEnd()
            .optionalEnd()
            .optionalStart().appendOffsetId().optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * @throws MalformedTimestampException valeur vide ou illisible (jamais de date "inventée")
     */
    public LocalDateTime parse(String column, Object raw) {
        if (raw instanceof LocalDateTime dateTime) return dateTime;
        if (raw instanceof LocalDate date) return date.atStartOfDay();
        if (raw == null || raw.toString().isBlank()) {
            throw new MalformedTimestampException(column, String.valueOf(raw));
        }

        String text = raw.toString().trim();
        try {
            TemporalAccessor parsed = FLEXIBLE_ISO.parse(text);
            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                return OffsetDateTime.from(parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return LocalDateTime.from(parsed);
        } catch (DateTimeException e) {
            throw new MalformedTimestampException(column, text, e);
        }
    }
}
