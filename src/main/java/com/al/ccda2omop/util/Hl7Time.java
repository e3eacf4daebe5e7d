package com.al.ccda2omop.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Utility class for parsing HL7 v3 (C-CDA) TS values.
 *
 * <p>
 * Accepted precisions, longest first: {@code YYYYMMDDHHMMSS},
 * {@code YYYYMMDDHHMM}, {@code YYYYMMDDHH}, {@code YYYYMMDD}, {@code YYYYMM}
 * and {@code YYYY}. Fractional seconds are ignored. Timezone suffixes
 * ({@code Z}, {@code +HHMM}, {@code -HHMM}) are stripped; the result is a
 * local date-time as written in the document.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
public final class Hl7Time {

    private Hl7Time() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final List<Precision> PRECISIONS = List.of(
            new Precision(14, formatter(ChronoField.YEAR, ChronoField.MONTH_OF_YEAR, ChronoField.DAY_OF_MONTH,
                    ChronoField.HOUR_OF_DAY, ChronoField.MINUTE_OF_HOUR, ChronoField.SECOND_OF_MINUTE)),
            new Precision(12, formatter(ChronoField.YEAR, ChronoField.MONTH_OF_YEAR, ChronoField.DAY_OF_MONTH,
                    ChronoField.HOUR_OF_DAY, ChronoField.MINUTE_OF_HOUR)),
            new Precision(10, formatter(ChronoField.YEAR, ChronoField.MONTH_OF_YEAR, ChronoField.DAY_OF_MONTH,
                    ChronoField.HOUR_OF_DAY)),
            new Precision(8, formatter(ChronoField.YEAR, ChronoField.MONTH_OF_YEAR, ChronoField.DAY_OF_MONTH)),
            new Precision(6, formatter(ChronoField.YEAR, ChronoField.MONTH_OF_YEAR)),
            new Precision(4, formatter(ChronoField.YEAR)));

    /**
     * Parse an HL7 timestamp.
     *
     * @param value HL7 TS string, e.g. "20240115103000-0500"
     * @return parsed local date-time, or null if empty or unparseable
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        String s = stripTimezone(value);
        for (Precision precision : PRECISIONS) {
            if (s.length() < precision.length) {
                continue;
            }
            try {
                return toDateTime(precision.formatter.parse(s.substring(0, precision.length)));
            } catch (DateTimeException e) {
                // try the next, shorter precision
            }
        }
        return null;
    }

    /**
     * Parse an HL7 timestamp and truncate it to midnight.
     */
    public static LocalDateTime parseDate(String value) {
        LocalDateTime parsed = parse(value);
        return parsed == null ? null : parsed.toLocalDate().atStartOfDay();
    }

    static String stripTimezone(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == 'Z') {
            end--;
        }
        String s = value.substring(0, end);
        for (char sep : new char[] { '+', '-' }) {
            if (s.indexOf(sep, 1) > 0) {
                return s.substring(0, s.lastIndexOf(sep));
            }
        }
        return s;
    }

    private static LocalDateTime toDateTime(TemporalAccessor parsed) {
        int year = parsed.get(ChronoField.YEAR);
        int month = parsed.isSupported(ChronoField.MONTH_OF_YEAR) ? parsed.get(ChronoField.MONTH_OF_YEAR) : 1;
        int day = parsed.isSupported(ChronoField.DAY_OF_MONTH) ? parsed.get(ChronoField.DAY_OF_MONTH) : 1;
        LocalDate date = LocalDate.of(year, month, day);
        int hour = parsed.isSupported(ChronoField.HOUR_OF_DAY) ? parsed.get(ChronoField.HOUR_OF_DAY) : 0;
        int minute = parsed.isSupported(ChronoField.MINUTE_OF_HOUR) ? parsed.get(ChronoField.MINUTE_OF_HOUR) : 0;
        int second = parsed.isSupported(ChronoField.SECOND_OF_MINUTE) ? parsed.get(ChronoField.SECOND_OF_MINUTE) : 0;
        return date.atTime(hour, minute, second);
    }

    private static DateTimeFormatter formatter(ChronoField... fields) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        for (ChronoField field : fields) {
            builder.appendValue(field, field == ChronoField.YEAR ? 4 : 2);
        }
        return builder.toFormatter().withResolverStyle(ResolverStyle.STRICT);
    }

    private static final class Precision {
        private final int length;
        private final DateTimeFormatter formatter;

        private Precision(int length, DateTimeFormatter formatter) {
            this.length = length;
            this.formatter = formatter;
        }
    }
}
