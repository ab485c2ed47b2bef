package com.supplychain.pipeline.normalize;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses the loosely formatted timestamps collectors send. Formats are tried in a fixed
 * order and the first that parses wins; local values are taken as UTC.
 */
@Slf4j
@Component
public class TimestampParser {

    private static final DateTimeFormatter SPACED_DATE_TIME = strict("uuuu-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DAY_FIRST = strict("dd/MM/uuuu");
    private static final DateTimeFormatter MONTH_FIRST = strict("MM/dd/uuuu");

    private final List<Format> formats = List.of(
            new Format("iso-instant", Instant::parse),
            new Format("iso-offset", s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant()),
            new Format("iso-zoned", s -> ZonedDateTime.parse(s, DateTimeFormatter.ISO_ZONED_DATE_TIME).toInstant()),
            new Format("iso-local", s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC)),
            new Format("spaced-local", s -> LocalDateTime.parse(s, SPACED_DATE_TIME).toInstant(ZoneOffset.UTC)),
            new Format("rfc-1123", s -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()),
            new Format("iso-date", s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant()),
            new Format("day-first", s -> LocalDate.parse(s, DAY_FIRST).atStartOfDay(ZoneOffset.UTC).toInstant()),
            new Format("month-first", s -> LocalDate.parse(s, MONTH_FIRST).atStartOfDay(ZoneOffset.UTC).toInstant())
    );

    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (Format format : formats) {
            try {
                return Optional.of(format.parser.apply(value));
            } catch (DateTimeParseException e) {
                log.trace("Timestamp '{}' is not {}", value, format.name);
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private static final class Format {
        private final String name;
        private final Function<String, Instant> parser;

        private Format(String name, Function<String, Instant> parser) {
            this.name = name;
            this.parser = parser;
        }
    }
}
