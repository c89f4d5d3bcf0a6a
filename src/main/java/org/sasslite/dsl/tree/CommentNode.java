package org.sasslite.dsl.tree;

import org.sasslite.dsl.SourceLine;

import java.util.List;

/**
 * A {@code /*} comment that is copied into the CSS output.
 *
 * Lines nested under the comment are kept verbatim and never interpreted.
 */
public final class CommentNode extends Node {

    private final String text;
    private List<SourceLine> bodyLines = List.of();

    /**
     * @param source The full comment line, starting with the comment marker
     */
    public CommentNode(String source) {
        this.text = source.substring(2).strip();
    }

    /**
     * @return the first line of the comment without the marker
     */
    public String getText() {
        return text;
    }

    public List<SourceLine> getBodyLines() {
        return bodyLines;
    }

    public void setBodyLines(List<SourceLine> lines) {
        this.bodyLines = List.copyOf(lines);
    }

    @Override
    public String toString() {
        return "Comment(" + text + ")";
    }
}
