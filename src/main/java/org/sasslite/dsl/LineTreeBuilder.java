package org.sasslite.dsl;

import java.util.ArrayList;
import java.util.List;

/**
 * Nests a flat list of logical lines by depth.
 *
 * A line one level deeper than the line before it starts a run of children
 * for that line. Lines are not interpreted here.
 */
public final class LineTreeBuilder {

    private final List<SourceLine> lines;

    private LineTreeBuilder(List<SourceLine> lines) {
        this.lines = lines;
    }

    /**
     * Builds the line tree for a tokenized document.
     *
     * @param lines Flat lines as produced by {@link IndentationTokenizer}
     * @return The top-level lines with their nested children
     * @throws SassSyntaxException if a line skips an indentation level
     */
    public static List<SourceLine> build(List<SourceLine> lines) {
        if (lines.isEmpty()) {
            return List.of();
        }
        return new LineTreeBuilder(lines).level(0).lines();
    }

    /**
     * Result of building one level: the sibling lines and the index of the
     * first line that was not consumed.
     */
    private record Level(List<SourceLine> lines, int next) {
    }

    private Level level(int start) {
        int base = lines.get(start).depth();
        List<SourceLine> siblings = new ArrayList<>();

        int i = start;
        while (i < lines.size() && lines.get(i).depth() >= base) {
            SourceLine line = lines.get(i);
            if (line.depth() == base) {
                siblings.add(line);
                i++;
                continue;
            }

            if (line.depth() > base + 1) {
                throw new SassSyntaxException("The line was indented " + (line.depth() - base)
                        + " levels deeper than the previous line.", line.lineNumber());
            }

            Level nested = level(i);
            int last = siblings.size() - 1;
            siblings.set(last, siblings.get(last).withChildren(nested.lines()));
            i = nested.next();
        }
        return new Level(siblings, i);
    }
}
