package org.sasslite.script;

import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.symbols.ConstantTable;

import java.util.List;

/**
 * ANTLR visitor that folds a constant expression parse tree into a value.
 *
 * The grammar structure:
 * - sequence: additive+ (joined with spaces)
 * - additive: multiplicative ((PLUS | MINUS) multiplicative)*
 * - multiplicative: unary ((TIMES | DIV | MOD) unary)*
 * - unary: MINUS unary | primary
 * - primary: ( sequence ) | !constant | "string" | number | color | word
 */
public class ScriptAstBuilder extends ConstantExpressionBaseVisitor<ScriptValue> {

    private final ConstantTable constants;

    public ScriptAstBuilder(ConstantTable constants) {
        this.constants = constants;
    }

    @Override
    public ScriptValue visitExpression(ConstantExpressionParser.ExpressionContext ctx) {
        return visit(ctx.sequence());
    }

    @Override
    public ScriptValue visitSequence(ConstantExpressionParser.SequenceContext ctx) {
        List<ConstantExpressionParser.AdditiveContext> parts = ctx.additive();
        ScriptValue result = visit(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            result = new ScriptString(result.toCss() + " " + visit(parts.get(i)).toCss());
        }
        return result;
    }

    @Override
    public ScriptValue visitAdditive(ConstantExpressionParser.AdditiveContext ctx) {
        ScriptValue result = visit(ctx.multiplicative(0));
        for (int i = 0; i < ctx.additiveOperator().size(); i++) {
            ScriptOperator op = ScriptOperator.fromSymbol(ctx.additiveOperator(i).getText());
            result = op.apply(result, visit(ctx.multiplicative(i + 1)));
        }
        return result;
    }

    @Override
    public ScriptValue visitMultiplicative(ConstantExpressionParser.MultiplicativeContext ctx) {
        ScriptValue result = visit(ctx.unary(0));
        for (int i = 0; i < ctx.multiplicativeOperator().size(); i++) {
            ScriptOperator op = ScriptOperator.fromSymbol(ctx.multiplicativeOperator(i).getText());
            result = op.apply(result, visit(ctx.unary(i + 1)));
        }
        return result;
    }

    @Override
    public ScriptValue visitNegation(ConstantExpressionParser.NegationContext ctx) {
        ScriptValue operand = visit(ctx.unary());
        if (operand instanceof ScriptNumber number) {
            return new ScriptNumber(-number.value(), number.unit());
        }
        if (operand instanceof ScriptString string) {
            return new ScriptString("-" + string.value());
        }
        throw new SassSyntaxException("Undefined operation: \"minus " + operand.toCss() + "\".");
    }

    @Override
    public ScriptValue visitPrimaryValue(ConstantExpressionParser.PrimaryValueContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public ScriptValue visitGrouping(ConstantExpressionParser.GroupingContext ctx) {
        return visit(ctx.sequence());
    }

    @Override
    public ScriptValue visitConstantReference(ConstantExpressionParser.ConstantReferenceContext ctx) {
        String name = ctx.CONSTANT().getText().substring(1);
        String value = constants.lookup(name)
                .orElseThrow(() -> new SassSyntaxException("Undefined constant: \"!" + name + "\"."));
        return literal(value);
    }

    @Override
    public ScriptValue visitQuotedString(ConstantExpressionParser.QuotedStringContext ctx) {
        return ScriptString.unquote(ctx.STRING().getText());
    }

    @Override
    public ScriptValue visitNumber(ConstantExpressionParser.NumberContext ctx) {
        return ScriptNumber.parse(ctx.NUMBER().getText());
    }

    @Override
    public ScriptValue visitColor(ConstantExpressionParser.ColorContext ctx) {
        return ScriptColor.parse(ctx.COLOR().getText());
    }

    @Override
    public ScriptValue visitWord(ConstantExpressionParser.WordContext ctx) {
        String word = ctx.WORD().getText();
        return ScriptColor.named(word).<ScriptValue>map(color -> color).orElse(new ScriptString(word));
    }

    /**
     * Re-reads a stored constant so arithmetic on it keeps its type:
     * "10px" stays a number, "#fff" stays a color.
     */
    private static ScriptValue literal(String value) {
        if (value.matches("(\\d*\\.\\d+|\\d+)([a-zA-Z]+|%)?")) {
            return ScriptNumber.parse(value);
        }
        if (value.matches("-(\\d*\\.\\d+|\\d+)([a-zA-Z]+|%)?")) {
            ScriptNumber positive = ScriptNumber.parse(value.substring(1));
            return new ScriptNumber(-positive.value(), positive.unit());
        }
        if (value.matches("#([0-9a-fA-F]{3}|[0-9a-fA-F]{6})")) {
            return ScriptColor.parse(value);
        }
        return ScriptColor.named(value).<ScriptValue>map(color -> color).orElse(new ScriptString(value));
    }
}
