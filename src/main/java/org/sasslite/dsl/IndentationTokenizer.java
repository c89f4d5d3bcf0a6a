package org.sasslite.dsl;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a Sass template into logical lines.
 *
 * Blank lines and lines starting with {@code //} in the first column are
 * dropped but still count towards line numbers. The first indented line fixes
 * the indentation unit; every other indented line must repeat it exactly.
 */
public final class IndentationTokenizer {

    private static final String LINE_COMMENT = "//";

    private String unit;
    private boolean first = true;

    /**
     * Tokenizes the whole template.
     *
     * @param template The raw document text
     * @return Logical lines in document order, without children
     * @throws SassSyntaxException on illegal indentation
     */
    public static List<SourceLine> tokenize(String template) {
        return new IndentationTokenizer().scan(template);
    }

    private List<SourceLine> scan(String template) {
        String normalized = template.replace("\r\n", "\n").replace('\r', '\n');
        String[] rawLines = normalized.split("\n", -1);

        List<SourceLine> lines = new ArrayList<>();
        for (int i = 0; i < rawLines.length; i++) {
            SourceLine line = scanLine(rawLines[i], i + 1);
            if (line != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    private SourceLine scanLine(String raw, int lineNumber) {
        String text = raw.strip();
        if (text.isEmpty() || raw.startsWith(LINE_COMMENT)) {
            return null;
        }

        String leading = raw.substring(0, leadingWhitespaceLength(raw));
        if (!leading.isEmpty()) {
            if (unit == null) {
                unit = leading;
            }
            if (first) {
                throw new SassSyntaxException("Indenting at the beginning of the document is illegal.", lineNumber);
            }
            if (unit.indexOf(' ') >= 0 && unit.indexOf('\t') >= 0) {
                throw new SassSyntaxException("Indentation can't use both tabs and spaces.", lineNumber);
            }
        }
        first = false;

        if (unit == null) {
            return SourceLine.of(text, 0, lineNumber);
        }

        int depth = leading.length() / unit.length();
        if (!unit.repeat(depth).equals(leading)) {
            throw new SassSyntaxException("Inconsistent indentation: "
                    + Indentation.describe(leading, true) + " used for indentation, "
                    + "but the rest of the document was indented using "
                    + Indentation.describe(unit) + ".", lineNumber);
        }
        return SourceLine.of(text, depth, lineNumber);
    }

    private static int leadingWhitespaceLength(String raw) {
        int i = 0;
        while (i < raw.length() && Character.isWhitespace(raw.charAt(i))) {
            i++;
        }
        return i;
    }
}
