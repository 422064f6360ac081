package com.portfoliosync.broker.mapper;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Null-safe number parsing for Kite SDK model fields.
 *
 * <p>The SDK is inconsistent: some numbers are {@code double}/{@code Double}, others are
 * Strings. Everything goes through {@code Object} so each mapper reads the same way.
 * Unparseable, blank and non-finite values become null.
 */
final class KiteValues {

    private KiteValues() {}

    static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer integer(Object value) {
        BigDecimal decimal = decimal(value);
        return decimal == null ? null : decimal.setScale(0, RoundingMode.HALF_UP).intValue();
    }

    static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
