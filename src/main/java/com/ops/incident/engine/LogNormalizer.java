package com.ops.incident.engine;

import com.ops.incident.model.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw key/value log record into a {@link LogRecord}.
 *
 * Accepted timestamps: {@link Instant}, {@link OffsetDateTime}, {@link ZonedDateTime},
 * {@link LocalDateTime} (read as UTC), {@link Date}, and ISO-8601 strings with or without
 * an offset (a trailing "Z" is UTC; no offset is read as UTC). The date and time may be
 * separated by a space, and a bare date is read as midnight UTC. A record whose timestamp
 * cannot be resolved yields an empty result and is left out of every aggregate.
 */
@Component
public class LogNormalizer {

    private static final Logger log = LoggerFactory.getLogger(LogNormalizer.class);

    // Date, then an optional time after a space or "T", then an optional offset. Date-only is midnight.
    private static final DateTimeFormatter RELAXED_ISO = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .toFormatter(Locale.ROOT);

    public Optional<LogRecord> normalize(Map<String, ?> raw) {
        if (raw == null) {
            return Optional.empty();
        }

        Instant timestamp = resolveTimestamp(raw.get("timestamp"));
        if (timestamp == null) {
            log.trace("Dropping log record with unresolvable timestamp: {}", raw.get("timestamp"));
            return Optional.empty();
        }

        Object level = raw.get("level");
        Object service = raw.get("service");
        Object message = raw.get("message");

        return Optional.of(LogRecord.builder()
                .timestamp(timestamp)
                .level(level != null ? level.toString().toLowerCase(Locale.ROOT) : "")
                .service(service != null ? service.toString() : LogRecord.UNKNOWN_SERVICE)
                .message(message != null ? message.toString() : "")
                .metadata(copyMetadata(raw.get("metadata")))
                .build());
    }

    static Instant resolveTimestamp(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof CharSequence text) {
            return parseIso(text.toString().trim());
        }
        return null;
    }

    private static Instant parseIso(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return toInstant(DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                    ZonedDateTime::from, LocalDateTime::from));
        } catch (DateTimeParseException e) {
            return parseRelaxed(text);
        }
    }

    private static Instant parseRelaxed(String text) {
        try {
            return toInstant(RELAXED_ISO.parseBest(text,
                    OffsetDateTime::from, LocalDateTime::from));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant toInstant(TemporalAccessor parsed) {
        if (parsed instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (parsed instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    private static Map<String, Object> copyMetadata(Object metadata) {
        if (!(metadata instanceof Map<?, ?> source) || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return Collections.unmodifiableMap(copy);
    }
}
