package com.spanlens.service.timestamp;

import com.spanlens.exception.TimestampParseException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the timestamp strings found in span documents into instants.
 * Strategies are tried in order and the first one that yields an instant wins:
 * strict ISO-8601 with offset, naive date-time plus a split-off offset, then a fixed
 * list of patterns with and without fraction / offset. Naive values are read as UTC.
 * @author kiransahoo
 */
@Slf4j
@Component
public class TimestampNormalizer {

    // Anything past microseconds is dropped, not rounded
    private static final Pattern EXCESS_FRACTION = Pattern.compile("(\\.\\d{6})\\d+");
    private static final Pattern TRAILING_OFFSET = Pattern.compile("^(.+)([+-]\\d{2}:\\d{2})$");

    // Date and time are separated by exactly one 'T' or one space
    private static final List<DateTimeFormatter> NAIVE_DATE_TIMES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .appendLiteral(' ')
                    .append(DateTimeFormatter.ISO_LOCAL_TIME)
                    .toFormatter());

    private static final DateTimeFormatter FRACTION_WITH_OFFSET = patternBuilder(true)
            .appendOffset("+HHmm", "+0000")
            .toFormatter();
    private static final DateTimeFormatter SECONDS_WITH_OFFSET = patternBuilder(false)
            .appendOffset("+HHmm", "+0000")
            .toFormatter();
    private static final DateTimeFormatter FRACTION_NAIVE = patternBuilder(true).toFormatter();
    private static final DateTimeFormatter SECONDS_NAIVE = patternBuilder(false).toFormatter();

    private final List<ParseStrategy> strategies = List.of(
            new ParseStrategy("iso-offset", this::parseIsoOffset),
            new ParseStrategy("split-offset", this::parseSplitOffset),
            new ParseStrategy("pattern-fraction-offset", s -> parseOffsetPattern(s, FRACTION_WITH_OFFSET)),
            new ParseStrategy("pattern-offset", s -> parseOffsetPattern(s, SECONDS_WITH_OFFSET)),
            new ParseStrategy("pattern-fraction", s -> parseNaivePattern(s, FRACTION_NAIVE)),
            new ParseStrategy("pattern", s -> parseNaivePattern(s, SECONDS_NAIVE))
    );

    /**
     * Parse a timestamp, truncated to microsecond precision.
     *
     * @throws TimestampParseException naming the original input when no strategy matches
     */
    public Instant parse(String raw) {
        return tryParse(raw).orElseThrow(() -> new TimestampParseException(raw));
    }

    public Optional<Instant> tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        String candidate = prepare(raw.trim());
        for (ParseStrategy strategy : strategies) {
            Optional<Instant> result = strategy.getParser().parse(candidate);
            if (result.isPresent()) {
                if (log.isTraceEnabled()) {
                    log.trace("Parsed '{}' with {}", raw, strategy.getName());
                }
                return result;
            }
        }
        return Optional.empty();
    }

    private String prepare(String value) {
        String prepared = EXCESS_FRACTION.matcher(value).replaceFirst("$1");
        if (prepared.endsWith("Z") || prepared.endsWith("z")) {
            prepared = prepared.substring(0, prepared.length() - 1) + "+00:00";
        }
        return prepared;
    }

    private Optional<Instant> parseIsoOffset(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseSplitOffset(String value) {
        Matcher matcher = TRAILING_OFFSET.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        LocalDateTime naive = null;
        for (DateTimeFormatter formatter : NAIVE_DATE_TIMES) {
            try {
                naive = LocalDateTime.parse(matcher.group(1), formatter);
                break;
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", matcher.group(1), formatter);
            }
        }
        if (naive == null) {
            return Optional.empty();
        }

        String offset = matcher.group(2);
        try {
            return Optional.of(naive.toInstant(ZoneOffset.of(offset)));
        } catch (DateTimeException e) {
            // Offset out of range; the value is read as UTC
            log.warn("Unresolvable offset '{}' in timestamp '{}', assuming UTC", offset, value);
            return Optional.of(naive.toInstant(ZoneOffset.UTC));
        }
    }

    private Optional<Instant> parseOffsetPattern(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(OffsetDateTime.parse(value, formatter).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseNaivePattern(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatterBuilder patternBuilder(boolean withFraction) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
                .appendPattern("uuuu-MM-dd'T'HH:mm:ss");
        if (withFraction) {
            builder.appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, true);
        }
        return builder;
    }

    @FunctionalInterface
    private interface TimestampParser {
        Optional<Instant> parse(String value);
    }

    @Value
    private static class ParseStrategy {
        String name;
        TimestampParser parser;
    }
}
