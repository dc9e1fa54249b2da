package io.trading.optionchain.persistence;

import io.trading.optionchain.model.SnapshotRow;

import java.math.BigDecimal;
import java.util.List;

/**
 * Renders row values as CSV text.
 *
 * <p>Null or empty values become an empty field. Floating values above 1e10 in magnitude are
 * written as truncated integers, other floating values as plain decimals, never in exponent form.
 * Fields containing a comma, quote or line break are quoted.
 */
public final class CsvValueFormatter {

    static final double INTEGER_THRESHOLD = 1e10;

    private static final String HEADER = String.join(",", SnapshotRow.COLUMNS);

    private CsvValueFormatter() {
    }

    public static String header() {
        return HEADER;
    }

    /**
     * Formats a row as one CSV line, without the line terminator.
     */
    public static String formatRow(SnapshotRow row) {
        List<Object> values = row.values();
        StringBuilder line = new StringBuilder(256);
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                line.append(',');
            }
            line.append(escape(format(values.get(i))));
        }
        return line.toString();
    }

    /**
     * Formats a single value.
     */
    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            return formatFloating(((Number) value).doubleValue());
        }
        return value.toString();
    }

    private static String formatFloating(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "";
        }
        if (Math.abs(value) > INTEGER_THRESHOLD) {
            return Long.toString((long) value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value);
        // "5.0E-5" parses with a trailing zero
        if (decimal.scale() > 1) {
            decimal = decimal.stripTrailingZeros();
        }
        return decimal.toPlainString();
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
            && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
