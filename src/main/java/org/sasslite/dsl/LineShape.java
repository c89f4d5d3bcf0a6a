package org.sasslite.dsl;

import java.util.regex.Pattern;

/**
 * The shapes a logical line can take, decided by its first character.
 */
public enum LineShape {
    ATTRIBUTE, // :color red
    CONSTANT, // !width = 10px
    SILENT_COMMENT, // // not in the output
    CSS_COMMENT, // /* kept in the output
    DIRECTIVE, // @import foo
    ESCAPED_RULE, // \=literal selector
    MIXIN_DEFINITION, // =bordered
    MIXIN_INCLUDE, // +bordered
    ALTERNATE_ATTRIBUTE, // color: red
    RULE; // anything else is a selector

    public static final char ATTRIBUTE_CHAR = ':';
    public static final char CONSTANT_CHAR = '!';
    public static final char COMMENT_CHAR = '/';
    public static final char SASS_COMMENT_CHAR = '/';
    public static final char CSS_COMMENT_CHAR = '*';
    public static final char DIRECTIVE_CHAR = '@';
    public static final char ESCAPE_CHAR = '\\';
    public static final char MIXIN_DEFINITION_CHAR = '=';
    public static final char MIXIN_INCLUDE_CHAR = '+';

    /** Lines of the form {@code name: value} or {@code name = value}. */
    public static final Pattern ALTERNATE_ATTRIBUTE_MATCHER = Pattern.compile("^[^\\s:]+\\s*[=:](\\s|$)");

    public static LineShape of(String text) {
        if (text.isEmpty()) {
            return RULE;
        }
        return switch (text.charAt(0)) {
            case ATTRIBUTE_CHAR -> ATTRIBUTE;
            case CONSTANT_CHAR -> CONSTANT;
            case COMMENT_CHAR -> commentShape(text);
            case DIRECTIVE_CHAR -> DIRECTIVE;
            case ESCAPE_CHAR -> ESCAPED_RULE;
            case MIXIN_DEFINITION_CHAR -> MIXIN_DEFINITION;
            case MIXIN_INCLUDE_CHAR -> isMixinInclude(text) ? MIXIN_INCLUDE : RULE;
            default -> ALTERNATE_ATTRIBUTE_MATCHER.matcher(text).find() ? ALTERNATE_ATTRIBUTE : RULE;
        };
    }

    private static LineShape commentShape(String text) {
        if (text.length() < 2) {
            return RULE;
        }
        return switch (text.charAt(1)) {
            case SASS_COMMENT_CHAR -> SILENT_COMMENT;
            case CSS_COMMENT_CHAR -> CSS_COMMENT;
            default -> RULE;
        };
    }

    // "+ p" is an adjacent sibling selector, "+name" includes a mixin
    private static boolean isMixinInclude(String text) {
        return text.length() > 1 && !Character.isWhitespace(text.charAt(1));
    }
}
