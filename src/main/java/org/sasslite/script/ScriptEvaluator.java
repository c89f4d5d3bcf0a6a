package org.sasslite.script;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.symbols.ConstantTable;

/**
 * ANTLR-based constant evaluator.
 *
 * Uses ConstantExpressionLexer and ConstantExpressionParser generated from
 * ConstantExpression.g4 and folds the parse tree with {@link ScriptAstBuilder}.
 */
public final class ScriptEvaluator implements ConstantEvaluator {

    @Override
    public String evaluate(String expression, ConstantTable constants, int line) {
        try {
            return parse(expression, constants).toCss();
        } catch (SassSyntaxException e) {
            if (!e.hasLocation()) {
                e.setSassLine(line);
            }
            throw e;
        }
    }

    /**
     * Parses and evaluates an expression.
     *
     * @throws SassSyntaxException if the expression is malformed or an
     *                             operation is not defined for its operands
     */
    public static ScriptValue parse(String expression, ConstantTable constants) {
        ErrorListener errors = new ErrorListener(expression);

        ConstantExpressionLexer lexer = new ConstantExpressionLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        ConstantExpressionParser parser = new ConstantExpressionParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        ConstantExpressionParser.ExpressionContext tree = parser.expression();
        return new ScriptAstBuilder(constants).visit(tree);
    }

    /**
     * Error listener that converts ANTLR errors to SassSyntaxException.
     */
    private static class ErrorListener extends BaseErrorListener {
        private final String expression;

        ErrorListener(String expression) {
            this.expression = expression;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new SassSyntaxException("Constant arithmetic error: \"" + expression + "\".");
        }
    }
}
