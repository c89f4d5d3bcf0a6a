package org.sasslite.script;

import java.util.Objects;

/**
 * A bare word or the content of a quoted string.
 */
public record ScriptString(String value) implements ScriptValue {

    public ScriptString {
        Objects.requireNonNull(value, "Value cannot be null");
    }

    /**
     * Removes the surrounding quotes and backslash escapes of a string token.
     */
    public static ScriptString unquote(String token) {
        String body = token.substring(1, token.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                c = body.charAt(++i);
            }
            sb.append(c);
        }
        return new ScriptString(sb.toString());
    }

    @Override
    public String toCss() {
        return value;
    }
}
