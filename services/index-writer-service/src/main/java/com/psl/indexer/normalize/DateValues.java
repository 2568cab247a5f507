package com.psl.indexer.normalize;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;

public final class DateValues {
    private static final DateTimeFormatter COMPACT_OFFSET = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .appendOffset("+HHMM", "Z")
        .toFormatter();
    private static final DateTimeFormatter SPACED_LOCAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private DateValues() {}

    /**
     * Parses the timestamp shapes the metadata source emits. Values without an offset are taken as UTC.
     *
     * @return the parsed instant with its offset, or null when the value matches no supported shape
     */
    public static OffsetDateTime parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        for (DateTimeFormatter formatter : List.of(DateTimeFormatter.ISO_OFFSET_DATE_TIME, COMPACT_OFFSET)) {
            try {
                return OffsetDateTime.parse(value, formatter);
            } catch (DateTimeParseException ignored) {
                // next shape
            }
        }
        for (DateTimeFormatter formatter : List.of(DateTimeFormatter.ISO_LOCAL_DATE_TIME, SPACED_LOCAL)) {
            try {
                return LocalDateTime.parse(value, formatter).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // next shape
            }
        }
        try {
            return LocalDate.parse(value).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    public static String format(OffsetDateTime value) {
        return value == null ? null : DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
    }

    /**
     * Month granularity ({@code yyyy-MM}) of either a month value or a full timestamp.
     */
    public static String month(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return MONTH.format(YearMonth.parse(value, MONTH));
        } catch (DateTimeParseException ignored) {
            OffsetDateTime parsed = parse(value);
            return parsed == null ? null : MONTH.format(parsed);
        }
    }
}
