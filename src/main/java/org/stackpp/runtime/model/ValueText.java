package org.stackpp.runtime.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Text renderings shared by the value model.
 * <p>
 * Numbers render as the shortest decimal that round-trips to the same double, written
 * without an exponent. Integral values carry no fractional part ({@code 7}, not
 * {@code 7.0}); the sign of negative zero is kept; non-finite values render as
 * {@code inf}, {@code -inf} and {@code NaN}.
 */
public final class ValueText {

    private ValueText() {
        // Utility class
    }

    /**
     * Formats a number the way {@code print} and {@code concat} see it.
     * @param value The number to format.
     * @return Its decimal text.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return (1.0 / value) < 0 ? "-0" : "0";
        }
        return shortestDecimal(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Finds the decimal with the fewest significant digits that reads back as {@code value}.
     * {@link Double#toString(double)} is not always shortest before JDK 19.
     */
    private static BigDecimal shortestDecimal(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == value) {
                return candidate;
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN));
    }

    /**
     * Formats a number for diagnostic output, keeping a {@code .0} on integral values.
     * @param value The number to format.
     * @return Its diagnostic text, e.g. {@code 7.0}.
     */
    public static String formatNumberDebug(double value) {
        String text = formatNumber(value);
        if (Double.isFinite(value) && text.indexOf('.') < 0) {
            return text + ".0";
        }
        return text;
    }

    /**
     * Quotes text for diagnostic output, escaping control characters, backslashes and quotes.
     * @param text The raw text.
     * @return The quoted text, e.g. {@code "a\nb"}.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
