package org.sasslite.engine;

import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.dsl.SourceLine;
import org.sasslite.dsl.tree.CommentNode;
import org.sasslite.dsl.tree.DirectiveNode;
import org.sasslite.dsl.tree.Node;
import org.sasslite.dsl.tree.RootNode;
import org.sasslite.dsl.tree.RuleNode;
import org.sasslite.engine.ClassifiedLine.Expansion;
import org.sasslite.engine.ClassifiedLine.Marker;
import org.sasslite.engine.ClassifiedLine.MarkerKind;
import org.sasslite.engine.ClassifiedLine.Single;

import java.util.List;

/**
 * Builds the node tree from nested logical lines.
 *
 * Classifies every line, attaches its children recursively and enforces the
 * structural rules: what may have children, what may only appear at the
 * document root, and how comma-continued selectors merge.
 */
final class TreeAssembler {

    private final SassEngine engine;
    private final LineClassifier classifier;

    TreeAssembler(SassEngine engine, ImportResolver importResolver) {
        this.engine = engine;
        this.classifier = new LineClassifier(engine, this, importResolver);
    }

    /**
     * Assembles the document lines under the root node.
     */
    RootNode assemble(List<SourceLine> lines) {
        RootNode root = new RootNode();
        appendChildren(root, lines, true);
        return root;
    }

    /**
     * Assembles lines that are not attached anywhere yet, such as the body of
     * an included mixin. The body is treated as nested content.
     */
    List<Node> assembleDetached(List<SourceLine> lines) {
        RootNode holder = new RootNode();
        appendChildren(holder, lines, false);
        return holder.getChildren();
    }

    private ClassifiedLine build(SourceLine line) {
        ClassifiedLine result = classifier.classify(line);

        if (result instanceof Single single) {
            Node node = single.node();
            node.setLine(line.lineNumber());
            node.setFilename(engine.options().filename());
            if (node instanceof CommentNode comment) {
                comment.setBodyLines(line.children());
            } else {
                appendChildren(node, line.children(), false);
            }
            return result;
        }

        if (line.hasChildren()) {
            int nestedLine = line.children().get(0).lineNumber();
            if (result instanceof Marker marker && marker.kind() == MarkerKind.CONSTANT) {
                throw new SassSyntaxException("Illegal nesting: Nothing may be nested beneath constants.", nestedLine);
            }
            if (result instanceof Expansion expansion) {
                throw new SassSyntaxException("Illegal nesting: Nothing may be nested beneath "
                        + expansion.kind().directiveName() + " directives.", nestedLine);
            }
        }
        return result;
    }

    private void appendChildren(Node parent, List<SourceLine> lines, boolean root) {
        ContinuedRule continued = new ContinuedRule();

        for (SourceLine line : lines) {
            ClassifiedLine child = build(line);

            if (child instanceof Single single && single.node() instanceof RuleNode rule && rule.isContinued()) {
                continued.accumulate(rule);
                continue;
            }
            if (continued.isOpen()) {
                child = new Single(continued.close(child));
            }
            validateAndAppend(parent, child, line, root);
        }

        continued.requireClosed();
    }

    private static void validateAndAppend(Node parent, ClassifiedLine child, SourceLine line, boolean root) {
        if (!root) {
            if (child instanceof Marker marker && marker.kind().isRootOnly()) {
                throw new SassSyntaxException(marker.kind() == MarkerKind.CONSTANT
                        ? "Constants may only be declared at the root of a document."
                        : "Mixins may only be defined at the root of a document.", line.lineNumber());
            }
            if (child instanceof Single single && single.node() instanceof DirectiveNode) {
                throw new SassSyntaxException("Import directives may only be used at the root of a document.",
                        line.lineNumber());
            }
        }

        if (child instanceof Expansion expansion) {
            // each spliced node is checked against the rootness of the line that produced it
            for (Node node : expansion.nodes()) {
                validateAndAppend(parent, new Single(node), line, root);
            }
        } else if (child instanceof Single single) {
            parent.add(single.node());
        }
    }

    /**
     * Selector lines ending in a comma, waiting for the line that closes them.
     * Idle while {@code pending} is null, accumulating otherwise.
     */
    private static final class ContinuedRule {
        private RuleNode pending;

        boolean isOpen() {
            return pending != null;
        }

        void accumulate(RuleNode rule) {
            if (rule.hasChildren()) {
                throw new SassSyntaxException("Rules can't end in commas.", rule.getLine());
            }
            if (pending == null) {
                pending = rule;
            } else {
                pending.addRules(rule);
            }
        }

        /**
         * Merges the closing rule into the pending one, which takes over its children.
         */
        RuleNode close(ClassifiedLine next) {
            if (!(next instanceof Single single && single.node() instanceof RuleNode closing)) {
                throw new SassSyntaxException("Rules can't end in commas.", pending.getLine());
            }
            RuleNode merged = pending;
            merged.addRules(closing);
            merged.setChildren(closing.getChildren());
            pending = null;
            return merged;
        }

        void requireClosed() {
            if (pending != null) {
                throw new SassSyntaxException("Rules can't end in commas.", pending.getLine());
            }
        }
    }
}
