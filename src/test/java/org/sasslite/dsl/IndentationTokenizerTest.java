package org.sasslite.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Indentation Tokenizer Tests")
class IndentationTokenizerTest {

    @Test
    @DisplayName("Lines get depth, line number and trimmed text")
    void testDepthAndLineNumbers() {
        String template = """
                #main
                  :width 97%
                  p
                    :color red
                """;

        List<SourceLine> lines = IndentationTokenizer.tokenize(template);

        assertEquals(4, lines.size());
        assertEquals("#main", lines.get(0).text());
        assertEquals(0, lines.get(0).depth());
        assertEquals(":width 97%", lines.get(1).text());
        assertEquals(1, lines.get(1).depth());
        assertEquals(":color red", lines.get(3).text());
        assertEquals(2, lines.get(3).depth());
        assertEquals(4, lines.get(3).lineNumber());
        assertTrue(lines.get(0).children().isEmpty(), "Tokenizer must not nest lines");
    }

    @Test
    @DisplayName("Blank lines and column-0 comments are dropped but keep their line numbers")
    void testDroppedLinesConsumeLineNumbers() {
        String template = "// header comment\n\n   \na\n  :b c\n";

        List<SourceLine> lines = IndentationTokenizer.tokenize(template);

        assertEquals(2, lines.size());
        assertEquals("a", lines.get(0).text());
        assertEquals(4, lines.get(0).lineNumber());
        assertEquals(5, lines.get(1).lineNumber());
    }

    @Test
    @DisplayName("Indented // lines are kept for the classifier")
    void testIndentedCommentIsKept() {
        List<SourceLine> lines = IndentationTokenizer.tokenize("a\n  // note\n");

        assertEquals(2, lines.size());
        assertEquals("// note", lines.get(1).text());
    }

    @Test
    @DisplayName("Every newline convention splits lines")
    void testNewlineConventions() {
        List<SourceLine> lines = IndentationTokenizer.tokenize("a\r\n  :b c\rd\ne");

        assertEquals(List.of("a", ":b c", "d", "e"), lines.stream().map(SourceLine::text).toList());
        assertEquals(List.of(1, 2, 3, 4), lines.stream().map(SourceLine::lineNumber).toList());
    }

    @Test
    @DisplayName("Tab indentation is measured in tabs")
    void testTabIndentation() {
        List<SourceLine> lines = IndentationTokenizer.tokenize("a\n\tb\n\t\tc\n");

        assertEquals(1, lines.get(1).depth());
        assertEquals(2, lines.get(2).depth());
    }

    @Test
    @DisplayName("Indenting the first line is illegal")
    void testIndentedFirstLine() {
        SassSyntaxException e = assertThrows(SassSyntaxException.class,
                () -> IndentationTokenizer.tokenize("\n\n  a\nb\n"));

        assertEquals("Indenting at the beginning of the document is illegal.", e.getMessage());
        assertEquals(3, e.getSassLine());
    }

    @Test
    @DisplayName("An indentation unit mixing tabs and spaces is illegal")
    void testMixedIndentationUnit() {
        SassSyntaxException e = assertThrows(SassSyntaxException.class,
                () -> IndentationTokenizer.tokenize("a\n \tb\n"));

        assertEquals("Indentation can't use both tabs and spaces.", e.getMessage());
        assertEquals(2, e.getSassLine());
    }

    @Test
    @DisplayName("Indentation that is not a multiple of the unit is reported in words")
    void testInconsistentIndentation() {
        SassSyntaxException e = assertThrows(SassSyntaxException.class,
                () -> IndentationTokenizer.tokenize("a\n  b\n   c\n"));

        assertEquals("Inconsistent indentation: 3 spaces were used for indentation, "
                + "but the rest of the document was indented using 2 spaces.", e.getMessage());
        assertEquals(3, e.getSassLine());
    }

    @Test
    @DisplayName("Spaces in a tab-indented document are inconsistent")
    void testSpacesInTabDocument() {
        SassSyntaxException e = assertThrows(SassSyntaxException.class,
                () -> IndentationTokenizer.tokenize("a\n\tb\n  c\n"));

        assertEquals("Inconsistent indentation: 2 spaces were used for indentation, "
                + "but the rest of the document was indented using 1 tab.", e.getMessage());
    }

    @Test
    @DisplayName("An empty document has no lines")
    void testEmptyDocument() {
        assertTrue(IndentationTokenizer.tokenize("").isEmpty());
        assertTrue(IndentationTokenizer.tokenize("\n\n// only a comment\n").isEmpty());
    }
}
