package com.al.ccda2omop.service.output;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Formats row values for OMOP CSV cells.
 *
 * <p>
 * Null is the empty cell. Date-times at midnight are written as dates.
 * Decimals use six significant digits with trailing zeros removed, switching
 * to exponent notation below 1e-4 and from 1e6 upward.
 */
public final class OmopValueFormatter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(6, RoundingMode.HALF_EVEN);

    private OmopValueFormatter() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            LocalDateTime dateTime = (LocalDateTime) value;
            LocalTime time = dateTime.toLocalTime();
            if (time.getHour() == 0 && time.getMinute() == 0 && time.getSecond() == 0) {
                return DATE.format(dateTime);
            }
            return DATE_TIME.format(dateTime);
        }
        if (value instanceof LocalDate) {
            return DATE.format((LocalDate) value);
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "1" : "0";
        }
        if (value instanceof Double || value instanceof Float) {
            return formatDecimal(((Number) value).doubleValue());
        }
        return value.toString();
    }

    static String formatDecimal(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0" : "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(SIGNIFICANT_DIGITS);
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent >= -4 && exponent < 6) {
            return rounded.stripTrailingZeros().toPlainString();
        }
        String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
        int magnitude = Math.abs(exponent);
        return mantissa + "e" + (exponent < 0 ? "-" : "+") + (magnitude < 10 ? "0" : "") + magnitude;
    }
}
