package com.al.ccda2omop.service.output;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class OmopValueFormatterTest {

    @Test
    public void testFormat_NullAndPlainValues() {
        assertEquals("", OmopValueFormatter.format(null));
        assertEquals("201826", OmopValueFormatter.format(201826L));
        assertEquals("3", OmopValueFormatter.format(3));
        assertEquals("44054006: Type 2 diabetes mellitus",
                OmopValueFormatter.format("44054006: Type 2 diabetes mellitus"));
        assertEquals("1", OmopValueFormatter.format(true));
        assertEquals("0", OmopValueFormatter.format(false));
    }

    @Test
    public void testFormat_Dates() {
        assertEquals("2024-01-10", OmopValueFormatter.format(LocalDate.of(2024, 1, 10)));
        assertEquals("2024-01-10", OmopValueFormatter.format(LocalDateTime.of(2024, 1, 10, 0, 0)));
        assertEquals("2024-01-10 09:35:00", OmopValueFormatter.format(LocalDateTime.of(2024, 1, 10, 9, 35)));
        assertEquals("2024-01-10 00:00:01", OmopValueFormatter.format(LocalDateTime.of(2024, 1, 10, 0, 0, 1)));
    }

    @Test
    public void testFormatDecimal_PlainRange() {
        assertEquals("72", OmopValueFormatter.format(72.0));
        assertEquals("7.2", OmopValueFormatter.format(7.2));
        assertEquals("72.5", OmopValueFormatter.format(72.5f));
        assertEquals("100", OmopValueFormatter.formatDecimal(100.0));
        assertEquals("0.3", OmopValueFormatter.formatDecimal(0.1 + 0.2));
        assertEquals("0.333333", OmopValueFormatter.formatDecimal(1.0 / 3));
        assertEquals("-2.5", OmopValueFormatter.formatDecimal(-2.5));
        assertEquals("0.0001", OmopValueFormatter.formatDecimal(0.0001));
        assertEquals("123457", OmopValueFormatter.formatDecimal(123456.7));
    }

    @Test
    public void testFormatDecimal_ExponentRange() {
        assertEquals("1e+06", OmopValueFormatter.formatDecimal(1_000_000.0));
        assertEquals("1.23457e+08", OmopValueFormatter.formatDecimal(123456789.0));
        assertEquals("1.5e-05", OmopValueFormatter.formatDecimal(0.000015));
        assertEquals("-2e-07", OmopValueFormatter.formatDecimal(-0.0000002));
    }

    @Test
    public void testFormatDecimal_SpecialValues() {
        assertEquals("0", OmopValueFormatter.formatDecimal(0.0));
        assertEquals("-0", OmopValueFormatter.formatDecimal(-0.0));
        assertEquals("nan", OmopValueFormatter.formatDecimal(Double.NaN));
        assertEquals("inf", OmopValueFormatter.formatDecimal(Double.POSITIVE_INFINITY));
        assertEquals("-inf", OmopValueFormatter.formatDecimal(Double.NEGATIVE_INFINITY));
    }
}
