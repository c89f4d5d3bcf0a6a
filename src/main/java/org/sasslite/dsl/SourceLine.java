package org.sasslite.dsl;

import java.util.List;
import java.util.Objects;

/**
 * One logical line of a Sass document.
 *
 * Produced flat by the {@link IndentationTokenizer}; the
 * {@link LineTreeBuilder} then nests lines under their parents.
 *
 * @param text       The line with surrounding whitespace removed
 * @param depth      Number of indentation units in front of the line
 * @param lineNumber 1-based line number in the source document
 * @param children   Lines nested one level deeper, in document order
 */
public record SourceLine(
        String text,
        int depth,
        int lineNumber,
        List<SourceLine> children) {

    public SourceLine {
        Objects.requireNonNull(text, "Text cannot be null");
        children = List.copyOf(children);
    }

    public static SourceLine of(String text, int depth, int lineNumber) {
        return new SourceLine(text, depth, lineNumber, List.of());
    }

    public SourceLine withChildren(List<SourceLine> nested) {
        return new SourceLine(text, depth, lineNumber, nested);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    @Override
    public String toString() {
        return text;
    }
}
