package org.sasslite.script;

import org.sasslite.dsl.SassSyntaxException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A number with an optional unit.
 *
 * @param value The numeric value
 * @param unit  The unit ("px", "em", "%"), empty when unitless
 */
public record ScriptNumber(double value, String unit) implements ScriptValue {

    private static final int PRECISION = 5;

    public ScriptNumber {
        Objects.requireNonNull(unit, "Unit cannot be null");
        if (!Double.isFinite(value)) {
            throw new SassSyntaxException("Number out of range.");
        }
    }

    /**
     * Parses a number token such as {@code 12px}, {@code .5em} or {@code 50%}.
     */
    public static ScriptNumber parse(String token) {
        int end = 0;
        while (end < token.length() && (Character.isDigit(token.charAt(end)) || token.charAt(end) == '.')) {
            end++;
        }
        return new ScriptNumber(Double.parseDouble(token.substring(0, end)), token.substring(end));
    }

    public boolean hasUnit() {
        return !unit.isEmpty();
    }

    @Override
    public String toCss() {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(PRECISION, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0" + unit;
        }
        return rounded.toPlainString() + unit;
    }
}
