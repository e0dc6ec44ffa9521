package com.coinbasis.ingestion.normalizer;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the timestamp formats seen in exchange exports. Values without an offset are taken as UTC.
 * Day-first patterns are tried after ISO ones; month-first input is not supported.
 */
public final class TimestampParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final int EPOCH_SECONDS_MAX_DIGITS = 10;

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            pattern("uuuu-MM-dd H:mm:ss"),
            pattern("uuuu-MM-dd H:mm"),
            pattern("uuuu/MM/dd H:mm:ss"),
            pattern("d/M/uuuu H:mm"),
            pattern("d/M/uuuu H:mm:ss"),
            pattern("d-M-uuuu H:mm"),
            pattern("d-M-uuuu H:mm:ss"),
            pattern("d.M.uuuu H:mm"),
            pattern("d.M.uuuu H:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.strip();
        if (DIGITS.matcher(text).matches()) {
            return parseEpoch(text);
        }
        Optional<Instant> instant = parseInstant(text);
        if (instant.isPresent()) {
            return instant;
        }
        return LOCAL_FORMATS.stream()
                .map(format -> parseLocal(text, format))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<Instant> parseInstant(String text) {
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseLocal(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDateTime.parse(text, format).toInstant(ZoneOffset.UTC));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseEpoch(String digits) {
        try {
            long value = Long.parseLong(digits);
            return Optional.of(digits.length() <= EPOCH_SECONDS_MAX_DIGITS
                    ? Instant.ofEpochSecond(value)
                    : Instant.ofEpochMilli(value));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter pattern(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
