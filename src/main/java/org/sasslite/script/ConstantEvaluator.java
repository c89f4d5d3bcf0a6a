package org.sasslite.script;

import org.sasslite.symbols.ConstantTable;

/**
 * Evaluates the right-hand side of constant assignments and scripted
 * attributes ({@code :width = !base * 2}).
 */
@FunctionalInterface
public interface ConstantEvaluator {

    /**
     * @param expression The expression text
     * @param constants  Constants visible at this point of the document
     * @param line       Source line of the expression, for error reporting
     * @return The evaluated value as CSS text
     * @throws org.sasslite.dsl.SassSyntaxException if the expression is invalid
     */
    String evaluate(String expression, ConstantTable constants, int line);
}
