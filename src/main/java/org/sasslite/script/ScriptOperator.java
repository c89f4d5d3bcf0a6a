package org.sasslite.script;

import org.sasslite.dsl.SassSyntaxException;

/**
 * Binary operators of constant expressions and their semantics for each
 * combination of operand types.
 */
public enum ScriptOperator {
    PLUS("plus"),
    MINUS("minus"),
    TIMES("times"),
    DIV("div"),
    MOD("mod");

    private final String word;

    ScriptOperator(String word) {
        this.word = word;
    }

    public static ScriptOperator fromSymbol(String symbol) {
        return switch (symbol) {
            case "+" -> PLUS;
            case "-" -> MINUS;
            case "*" -> TIMES;
            case "/" -> DIV;
            case "%" -> MOD;
            default -> throw new IllegalArgumentException("Unknown operator: " + symbol);
        };
    }

    /**
     * Applies this operator.
     *
     * @throws SassSyntaxException if the operand types or units do not support it
     */
    public ScriptValue apply(ScriptValue left, ScriptValue right) {
        if (left instanceof ScriptString || right instanceof ScriptString) {
            if (this == PLUS) {
                return new ScriptString(left.toCss() + right.toCss());
            }
            throw undefined(left, right);
        }
        if (left instanceof ScriptNumber l && right instanceof ScriptNumber r) {
            return applyNumbers(l, r);
        }
        if (left instanceof ScriptColor l && right instanceof ScriptColor r) {
            return applyColors(l, r);
        }
        if (left instanceof ScriptColor l && right instanceof ScriptNumber r) {
            return applyColor(l, r.value());
        }
        // number op color only commutes
        if (left instanceof ScriptNumber l && right instanceof ScriptColor r && (this == PLUS || this == TIMES)) {
            return applyColor(r, l.value());
        }
        throw undefined(left, right);
    }

    private ScriptValue applyNumbers(ScriptNumber left, ScriptNumber right) {
        return switch (this) {
            case PLUS -> new ScriptNumber(left.value() + right.value(), sameUnit(left, right));
            case MINUS -> new ScriptNumber(left.value() - right.value(), sameUnit(left, right));
            case TIMES -> new ScriptNumber(left.value() * right.value(), singleUnit(left, right));
            case DIV -> new ScriptNumber(left.value() / nonZero(right.value()), quotientUnit(left, right));
            case MOD -> new ScriptNumber(left.value() % nonZero(right.value()), quotientUnit(left, right));
        };
    }

    private ScriptValue applyColors(ScriptColor left, ScriptColor right) {
        return switch (this) {
            case PLUS -> left.combine(right, Integer::sum);
            case MINUS -> left.combine(right, (a, b) -> a - b);
            case TIMES -> left.combine(right, (a, b) -> a * b);
            case DIV -> left.combine(right, (a, b) -> a / (int) nonZero(b));
            case MOD -> left.combine(right, (a, b) -> a % (int) nonZero(b));
        };
    }

    private ScriptValue applyColor(ScriptColor color, double operand) {
        return switch (this) {
            case PLUS -> color.combine(operand, (channel, n) -> channel + n);
            case MINUS -> color.combine(operand, (channel, n) -> channel - n);
            case TIMES -> color.combine(operand, (channel, n) -> channel * n);
            case DIV -> color.combine(nonZero(operand), (channel, n) -> channel / n);
            case MOD -> color.combine(nonZero(operand), (channel, n) -> channel % n);
        };
    }

    private static String sameUnit(ScriptNumber left, ScriptNumber right) {
        if (left.hasUnit() && right.hasUnit() && !left.unit().equals(right.unit())) {
            throw incompatible(left, right);
        }
        return left.hasUnit() ? left.unit() : right.unit();
    }

    private static String singleUnit(ScriptNumber left, ScriptNumber right) {
        if (left.hasUnit() && right.hasUnit()) {
            throw incompatible(left, right);
        }
        return left.hasUnit() ? left.unit() : right.unit();
    }

    private static String quotientUnit(ScriptNumber left, ScriptNumber right) {
        if (!right.hasUnit()) {
            return left.unit();
        }
        if (right.unit().equals(left.unit())) {
            return "";
        }
        throw incompatible(left, right);
    }

    private static double nonZero(double divisor) {
        if (divisor == 0) {
            throw new SassSyntaxException("Division by zero.");
        }
        return divisor;
    }

    private static SassSyntaxException incompatible(ScriptNumber left, ScriptNumber right) {
        return new SassSyntaxException("Incompatible units: "
                + (left.hasUnit() ? left.unit() : "none") + " and "
                + (right.hasUnit() ? right.unit() : "none") + ".");
    }

    private SassSyntaxException undefined(ScriptValue left, ScriptValue right) {
        return new SassSyntaxException("Undefined operation: \"" + left.toCss() + " " + word + " " + right.toCss() + "\".");
    }
}
