package com.hotlistdigest.core.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

public final class DateTimeParsing {
    private static final long MILLIS_THRESHOLD = 10_000_000_000L;

    private static final DateTimeFormatter OFFSET_NO_COLON = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");
    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm")
    );
    private static final List<DateTimeFormatter> LOCAL_DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd")
    );

    private static final List<BiFunction<String, ZoneId, Instant>> PARSERS = buildParsers();

    private DateTimeParsing() {
    }

    public static Optional<Instant> parse(Object value, ZoneId zone) {
        if (value instanceof Number number) {
            return fromEpoch(number.doubleValue());
        }
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        String raw = text.trim();
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        if (raw.chars().allMatch(Character::isDigit)) {
            try {
                return fromEpoch(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return PARSERS.stream()
                .map(parser -> safelyParse(parser, raw, zone))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private static Optional<Instant> fromEpoch(double epoch) {
        if (!(epoch > 0) || Double.isInfinite(epoch)) {
            return Optional.empty();
        }
        long millis = epoch > MILLIS_THRESHOLD ? (long) epoch : (long) (epoch * 1000);
        return Optional.of(Instant.ofEpochMilli(millis));
    }

    private static List<BiFunction<String, ZoneId, Instant>> buildParsers() {
        List<BiFunction<String, ZoneId, Instant>> parsers = new ArrayList<>();
        parsers.add((v, zone) -> Instant.parse(v));
        parsers.add((v, zone) -> OffsetDateTime.parse(v).toInstant());
        parsers.add((v, zone) -> ZonedDateTime.parse(v).toInstant());
        parsers.add((v, zone) -> OffsetDateTime.parse(v, OFFSET_NO_COLON).toInstant());
        parsers.add((v, zone) -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        for (DateTimeFormatter format : LOCAL_DATE_TIME_FORMATS) {
            parsers.add((v, zone) -> LocalDateTime.parse(v, format).atZone(zone).toInstant());
        }
        for (DateTimeFormatter format : LOCAL_DATE_FORMATS) {
            parsers.add((v, zone) -> LocalDate.parse(v, format).atStartOfDay(zone).toInstant());
        }
        return List.copyOf(parsers);
    }

    private static Optional<Instant> safelyParse(BiFunction<String, ZoneId, Instant> parser, String value, ZoneId zone) {
        try {
            return Optional.of(parser.apply(value, zone));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
