package org.sasslite.script;

/**
 * Sealed interface representing values computed by constant expressions.
 *
 * Type hierarchy:
 * ScriptValue
 * ├── ScriptNumber (10, 1.5em, 50%)
 * ├── ScriptColor (#f00, red)
 * └── ScriptString (bare words and quoted strings)
 */
public sealed interface ScriptValue
        permits ScriptNumber, ScriptColor, ScriptString {

    /**
     * @return the value as it is written into CSS
     */
    String toCss();
}
