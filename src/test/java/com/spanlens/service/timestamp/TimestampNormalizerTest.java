package com.spanlens.service.timestamp;

import com.spanlens.exception.TimestampParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampNormalizerTest {

    private final TimestampNormalizer normalizer = new TimestampNormalizer();

    @Test
    void parsesZuluWithMicroseconds() {
        assertThat(normalizer.parse("2024-03-01T12:00:00.123456Z"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00.123456Z"));
    }

    @Test
    void truncatesNanosecondsInsteadOfRounding() {
        assertThat(normalizer.parse("2024-03-01T12:00:00.123456999Z"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00.123456Z"));
    }

    @Test
    void appliesExplicitOffset() {
        assertThat(normalizer.parse("2024-03-01T14:30:00.5+02:00"))
                .isEqualTo(Instant.parse("2024-03-01T12:30:00.500Z"));
        assertThat(normalizer.parse("2024-03-01T07:00:00-05:00"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    void acceptsSpaceSeparatedDateTimeWithOffset() {
        assertThat(normalizer.parse("2024-03-01 13:00:00+01:00"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    void readsUnresolvableOffsetAsUtc() {
        // +19:00 is outside the range of valid offsets
        assertThat(normalizer.parse("2024-03-01T12:00:00+19:00"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    void acceptsCompactOffset() {
        assertThat(normalizer.parse("2024-03-01T14:00:00.250+0200"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00.250Z"));
        assertThat(normalizer.parse("2024-03-01T14:00:00+0200"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    void readsNaiveTimestampsAsUtc() {
        assertThat(normalizer.parse("2024-03-01T12:00:00.75"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00.750Z"));
        assertThat(normalizer.parse("2024-03-01T12:00:00"))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a timestamp", "2024-13-45T99:00:00Z", "1709294400",
            "2024-03-0112:00:00+01:00", "2024-03-01T 12:00:00+01:00", "2024-03-01 T12:00:00+01:00"})
    void rejectsUnparseableInput(String input) {
        assertThat(normalizer.tryParse(input)).isEmpty();
        assertThatThrownBy(() -> normalizer.parse(input))
                .isInstanceOf(TimestampParseException.class)
                .hasMessageContaining(input);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> normalizer.parse(null))
                .isInstanceOf(TimestampParseException.class);
    }

    @Test
    void recoversInstantTruncatedToMicrosecondsForAnyFractionLength() {
        Instant base = Instant.parse("2024-06-15T08:09:10.987654321Z");
        ZoneOffset[] offsets = {ZoneOffset.UTC, ZoneOffset.ofHoursMinutes(5, 30), ZoneOffset.ofHours(-8)};

        for (int digits = 0; digits <= 9; digits++) {
            Instant expectedSource = base.truncatedTo(ChronoUnit.SECONDS)
                    .plusNanos(fractionNanos(base.getNano(), digits));
            for (ZoneOffset offset : offsets) {
                String text = format(expectedSource, offset, digits);
                assertThat(normalizer.parse(text))
                        .as(text)
                        .isEqualTo(expectedSource.truncatedTo(ChronoUnit.MICROS));
            }
        }
    }

    private static long fractionNanos(int nanos, int digits) {
        long scale = (long) Math.pow(10, 9 - digits);
        return nanos / scale * scale;
    }

    private static String format(Instant instant, ZoneOffset offset, int digits) {
        OffsetDateTime local = instant.atOffset(offset);
        String text = local.format(DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss"));
        if (digits > 0) {
            String fraction = String.format("%09d", local.getNano()).substring(0, digits);
            text += "." + fraction;
        }
        return text + (offset.equals(ZoneOffset.UTC) ? "Z" : offset.getId());
    }
}
