package org.sasslite.engine;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Options for one compilation.
 *
 * @param style           Output style used when rendering CSS
 * @param loadPaths       Directories searched for imported files, in order
 * @param filename        The file being compiled, for error messages; may be null
 * @param attributeSyntax The only attribute syntax allowed, or null to allow both
 */
public record SassOptions(
        OutputStyle style,
        List<String> loadPaths,
        String filename,
        AttributeSyntax attributeSyntax) {

    public enum OutputStyle {
        NESTED,
        EXPANDED;

        public static OutputStyle fromName(String name) {
            return valueOf(name.toUpperCase(Locale.ROOT));
        }
    }

    public enum AttributeSyntax {
        NORMAL, // :name value
        ALTERNATE; // name: value

        public static AttributeSyntax fromName(String name) {
            return valueOf(name.toUpperCase(Locale.ROOT));
        }
    }

    public SassOptions {
        Objects.requireNonNull(style, "Style cannot be null");
        loadPaths = List.copyOf(loadPaths);
    }

    public static SassOptions defaults() {
        return new SassOptions(OutputStyle.NESTED, List.of("."), null, null);
    }

    public SassOptions withStyle(OutputStyle newStyle) {
        return new SassOptions(newStyle, loadPaths, filename, attributeSyntax);
    }

    public SassOptions withLoadPaths(List<String> newLoadPaths) {
        return new SassOptions(style, newLoadPaths, filename, attributeSyntax);
    }

    public SassOptions withFilename(String newFilename) {
        return new SassOptions(style, loadPaths, newFilename, attributeSyntax);
    }

    public SassOptions withAttributeSyntax(AttributeSyntax newSyntax) {
        return new SassOptions(style, loadPaths, filename, newSyntax);
    }
}
