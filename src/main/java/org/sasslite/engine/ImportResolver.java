package org.sasslite.engine;

import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.dsl.tree.DirectiveNode;
import org.sasslite.dsl.tree.Node;
import org.sasslite.dsl.tree.RootNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves {@code @import} targets against the load paths and compiles the
 * imported files.
 *
 * An imported file starts with every constant and mixin its importer has
 * defined so far. Once it is compiled, the importer continues with the
 * imported file's tables, so definitions made by the import are visible to
 * the lines after it.
 */
final class ImportResolver {

    private static final String SASS_EXTENSION = ".sass";
    private static final String CSS_EXTENSION = ".css";
    private static final String PARTIAL_PREFIX = "_";

    private final SassEngine importer;

    ImportResolver(SassEngine importer) {
        this.importer = importer;
    }

    /**
     * Imports a comma-separated list of files, left to right.
     *
     * @param files The value of the import directive
     * @param line  The line of the import directive
     * @return The nodes of every imported file, plus a passthrough directive
     *         for each plain CSS import
     */
    List<Node> importFiles(String files, int line) {
        List<Node> nodes = new ArrayList<>();
        for (String name : files.split(",\\s*")) {
            String path = findFileToImport(name, line);
            if (path.endsWith(CSS_EXTENSION)) {
                DirectiveNode directive = new DirectiveNode("@import url(" + path + ")");
                directive.setLine(line);
                directive.setFilename(importer.options().filename());
                nodes.add(directive);
            } else {
                nodes.addAll(compile(path, line));
            }
        }
        return nodes;
    }

    /**
     * Maps an import name to a file path.
     *
     * {@code foo.css} is returned unchanged. Otherwise {@code _foo.sass} and
     * then {@code foo.sass} are tried in every load path. A bare name that
     * matches nothing falls back to {@code foo.css}; an explicit
     * {@code foo.sass} that matches nothing is an error.
     */
    String findFileToImport(String name, int line) {
        String base = name;
        boolean wasSass = false;
        if (name.endsWith(SASS_EXTENSION)) {
            base = name.substring(0, name.length() - SASS_EXTENSION.length());
            wasSass = true;
        } else if (name.endsWith(CSS_EXTENSION)) {
            return name;
        }

        Optional<String> found = findFullPath(base + SASS_EXTENSION);
        if (found.isPresent()) {
            return found.get();
        }
        if (wasSass) {
            throw new SassSyntaxException("File to import not found or unreadable: " + name + ".", line);
        }
        return base + CSS_EXTENSION;
    }

    private Optional<String> findFullPath(String filename) {
        SourceFileSystem fileSystem = importer.fileSystem();
        for (String loadPath : importer.options().loadPaths()) {
            for (String candidate : List.of(partial(filename), filename)) {
                String fullPath = fileSystem.resolve(loadPath, candidate);
                if (fileSystem.isReadable(fullPath)) {
                    return Optional.of(fullPath);
                }
            }
        }
        return Optional.empty();
    }

    // dir/name.sass -> dir/_name.sass
    private static String partial(String filename) {
        int slash = filename.lastIndexOf('/');
        return filename.substring(0, slash + 1) + PARTIAL_PREFIX + filename.substring(slash + 1);
    }

    // main.sass and ./main.sass name the same file
    private static String canonical(String path) {
        return Path.of(path).toAbsolutePath().normalize().toString();
    }

    private List<Node> compile(String path, int line) {
        List<String> openFiles = importer.importStack();
        int open = openFiles.stream().map(ImportResolver::canonical).toList().indexOf(canonical(path));
        if (open >= 0) {
            throw new SassSyntaxException("Circular import: "
                    + String.join(" -> ", openFiles.subList(open, openFiles.size()))
                    + " -> " + path + ".", line);
        }

        String source;
        try {
            source = importer.fileSystem().read(path);
        } catch (IOException e) {
            throw new SassSyntaxException("File to import not found or unreadable: " + path + ".", line, e);
        }

        SassEngine nested = importer.nestedEngine(source, path);
        nested.seedTables(importer);

        RootNode root;
        try {
            root = nested.buildTree();
        } catch (SassSyntaxException e) {
            e.addBacktraceEntry(path);
            throw e;
        }

        importer.adoptTables(nested);
        return root.getChildren();
    }
}
