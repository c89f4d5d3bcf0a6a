package org.sasslite.engine;

import org.sasslite.dsl.tree.Node;

import java.util.List;

/**
 * Result of classifying one logical line.
 *
 * Type hierarchy:
 * ClassifiedLine
 * ├── Single (one node: rule, attribute, comment, directive)
 * ├── Marker (a line that produces no node: constant, mixin, silent comment)
 * └── Expansion (nodes spliced in by an import or a mixin inclusion)
 */
public sealed interface ClassifiedLine {

    record Single(Node node) implements ClassifiedLine {
    }

    record Marker(MarkerKind kind) implements ClassifiedLine {
    }

    record Expansion(ExpansionKind kind, List<Node> nodes) implements ClassifiedLine {
        public Expansion {
            nodes = List.copyOf(nodes);
        }
    }

    enum MarkerKind {
        CONSTANT(true),
        MIXIN(true),
        SILENT_COMMENT(false);

        private final boolean rootOnly;

        MarkerKind(boolean rootOnly) {
            this.rootOnly = rootOnly;
        }

        public boolean isRootOnly() {
            return rootOnly;
        }
    }

    enum ExpansionKind {
        IMPORT("import"),
        MIXIN_INCLUDE("mixin");

        private final String directiveName;

        ExpansionKind(String directiveName) {
            this.directiveName = directiveName;
        }

        /**
         * @return the construct name used in nesting errors
         */
        public String directiveName() {
            return directiveName;
        }
    }
}
