package org.sasslite.css;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.engine.SassEngine;
import org.sasslite.engine.SassOptions;
import org.sasslite.engine.SassOptions.OutputStyle;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CSS Renderer Tests")
class CssRendererTest {

    private static String render(String template) {
        return new SassEngine(template).render();
    }

    private static String renderExpanded(String template) {
        return new SassEngine(template, SassOptions.defaults().withStyle(OutputStyle.EXPANDED)).render();
    }

    @Nested
    @DisplayName("Nested style")
    class NestedStyle {

        @Test
        @DisplayName("Child rules are indented below their parent")
        void testNestedRules() {
            String css = render("""
                    #main
                      :width 97%
                      p
                        :color red
                    """);

            assertEquals("#main {\n  width: 97%; }\n  #main p {\n    color: red; }\n", css);
        }

        @Test
        @DisplayName("Top-level blocks are separated by a blank line")
        void testTopLevelBlocks() {
            String css = render("a\n  :x 1\nb\n  :y 2\n");

            assertEquals("a {\n  x: 1; }\n\nb {\n  y: 2; }\n", css);
        }

        @Test
        @DisplayName("A rule without declarations is skipped but its children keep their depth")
        void testEmptyParent() {
            String css = render("""
                    a
                      &:hover
                        :color red
                    """);

            assertEquals("a:hover {\n  color: red; }\n", css);
        }
    }

    @Test
    @DisplayName("Expanded style closes every block on its own line")
    void testExpandedStyle() {
        String css = renderExpanded("""
                #main
                  :width 97%
                  p
                    :color red
                """);

        assertEquals("#main {\n  width: 97%;\n}\n#main p {\n  color: red;\n}\n", css);
    }

    @Test
    @DisplayName("Attribute namespaces are joined with dashes")
    void testAttributeNamespace() {
        String css = render("""
                a
                  :font
                    :family arial
                    :size 2em
                """);

        assertEquals("a {\n  font-family: arial;\n  font-size: 2em; }\n", css);
    }

    @Test
    @DisplayName("Comma-separated parents and children form every combination")
    void testSelectorCrossProduct() {
        assertEquals("a c, b c {\n  x: y; }\n", render("a, b\n  c\n    :x y\n"));
        assertEquals(List.of("a:hover", "a .b", "c:hover", "c .b"),
                CssRenderer.resolveSelectors(List.of("a", "c"), List.of("&:hover", ".b")));
    }

    @Test
    @DisplayName("Continued selectors render as one rule")
    void testContinuedRule() {
        assertEquals("a, b {\n  x: y; }\n", render("a,\nb\n  :x y\n"));
    }

    @Test
    @DisplayName("Comments keep their nested lines")
    void testComment() {
        String css = render("""
                /* hi
                  there
                a
                  :x y
                """);

        assertEquals("/* hi\n * there */\n\na {\n  x: y; }\n", css);
    }

    @Test
    @DisplayName("Directives end with a semicolon")
    void testDirective() {
        String css = render("@import url(foo.css)\na\n  :x y\n");

        assertEquals("@import url(foo.css);\n\na {\n  x: y; }\n", css);
    }

    @Test
    @DisplayName("An empty document renders as nothing")
    void testEmpty() {
        assertEquals("", render(""));
    }

    @Nested
    @DisplayName("Invalid attributes")
    class InvalidAttributes {

        @Test
        @DisplayName("Attributes cannot be at the root")
        void testRootAttribute() {
            SassSyntaxException e = assertThrows(SassSyntaxException.class, () -> render(":color red\n"));

            assertEquals("Attributes aren't allowed at the root of a document.", e.getMessage());
            assertEquals(1, e.getSassLine());
        }

        @Test
        @DisplayName("An attribute needs a value or nested attributes")
        void testNoValue() {
            SassSyntaxException e = assertThrows(SassSyntaxException.class, () -> render("a\n  :color\n"));

            assertEquals("Invalid attribute: \":color\" (no value).", e.getMessage());
            assertEquals(2, e.getSassLine());
        }

        @Test
        @DisplayName("Values ending in a semicolon are rejected")
        void testTrailingSemicolon() {
            SassSyntaxException e = assertThrows(SassSyntaxException.class, () -> render("a\n  :color red;\n"));

            assertEquals("Invalid attribute: \":color red;\" (This isn't CSS!).", e.getMessage());
        }

        @Test
        @DisplayName("Render errors name the file of the offending node")
        void testRenderErrorFilename() {
            SassOptions options = SassOptions.defaults().withFilename("style.sass");

            SassSyntaxException e = assertThrows(SassSyntaxException.class,
                    () -> new SassEngine(":color red\n", options).render());

            assertEquals("style.sass", e.getSassFilename());
        }
    }
}
