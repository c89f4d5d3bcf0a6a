package org.sasslite.css;

import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.dsl.SourceLine;
import org.sasslite.dsl.tree.AttributeNode;
import org.sasslite.dsl.tree.CommentNode;
import org.sasslite.dsl.tree.DirectiveNode;
import org.sasslite.dsl.tree.Node;
import org.sasslite.dsl.tree.RootNode;
import org.sasslite.dsl.tree.RuleNode;
import org.sasslite.engine.SassOptions.OutputStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a compiled node tree as CSS.
 *
 * Nested rules are flattened into full selectors. In the nested style a
 * child rule is indented below its parent and blocks close on their last
 * declaration; in the expanded style every rule starts at column 0.
 */
public final class CssRenderer {

    private static final String INDENT = "  ";
    private static final String PARENT_REFERENCE = "&";

    private final OutputStyle style;

    public CssRenderer(OutputStyle style) {
        this.style = style;
    }

    /**
     * @throws SassSyntaxException if the tree contains attributes that cannot
     *                             be written as CSS
     */
    public String render(RootNode root) {
        List<String> blocks = new ArrayList<>();
        for (Node child : root.getChildren()) {
            List<String> parts = new ArrayList<>();
            if (child instanceof AttributeNode) {
                throw error("Attributes aren't allowed at the root of a document.", child);
            } else if (child instanceof RuleNode rule) {
                renderRule(rule, List.of(), 0, parts);
            } else if (child instanceof CommentNode comment) {
                parts.add(renderComment(comment, ""));
            } else if (child instanceof DirectiveNode directive) {
                parts.add(renderDirective(directive));
            }
            if (!parts.isEmpty()) {
                blocks.add(String.join("\n", parts));
            }
        }
        return blocks.isEmpty() ? "" : String.join("\n\n", blocks) + "\n";
    }

    private void renderRule(RuleNode rule, List<String> parentSelectors, int depth, List<String> out) {
        List<String> selectors = resolveSelectors(parentSelectors, rule.getSelectors());
        String indent = style == OutputStyle.NESTED ? INDENT.repeat(depth) : "";

        List<String> declarations = new ArrayList<>();
        List<RuleNode> nested = new ArrayList<>();
        for (Node child : rule.getChildren()) {
            if (child instanceof AttributeNode attribute) {
                collectDeclarations(attribute, null, declarations);
            } else if (child instanceof CommentNode comment) {
                declarations.add(renderComment(comment, indent + INDENT));
            } else if (child instanceof RuleNode nestedRule) {
                nested.add(nestedRule);
            }
        }

        if (!declarations.isEmpty()) {
            out.add(indent + String.join(", ", selectors) + " {\n" + block(declarations, indent));
        }
        int childDepth = declarations.isEmpty() ? depth : depth + 1;
        for (RuleNode nestedRule : nested) {
            renderRule(nestedRule, selectors, childDepth, out);
        }
    }

    private String block(List<String> declarations, String indent) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < declarations.size(); i++) {
            String declaration = declarations.get(i);
            if (!declaration.startsWith(indent + INDENT)) {
                sb.append(indent).append(INDENT);
            }
            sb.append(declaration);
            if (i < declarations.size() - 1) {
                sb.append('\n');
            }
        }
        sb.append(style == OutputStyle.NESTED ? " }" : "\n" + indent + "}");
        return sb.toString();
    }

    /**
     * Combines every parent selector with every child selector. A child that
     * mentions {@code &} places the parent there; otherwise the child becomes
     * a descendant of the parent.
     */
    static List<String> resolveSelectors(List<String> parents, List<String> children) {
        if (parents.isEmpty()) {
            return children;
        }
        List<String> resolved = new ArrayList<>();
        for (String parent : parents) {
            for (String child : children) {
                resolved.add(child.contains(PARENT_REFERENCE)
                        ? child.replace(PARENT_REFERENCE, parent)
                        : parent + " " + child);
            }
        }
        return resolved;
    }

    private void collectDeclarations(AttributeNode attribute, String namespace, List<String> out) {
        String name = namespace == null ? attribute.getName() : namespace + "-" + attribute.getName();
        String value = attribute.getValue();

        if (value.endsWith(";")) {
            throw error("Invalid attribute: \":" + attribute.getName() + " " + value + "\" (This isn't CSS!).", attribute);
        }
        if (value.isEmpty() && !attribute.hasChildren()) {
            throw error("Invalid attribute: \":" + attribute.getName() + "\" (no value).", attribute);
        }

        if (!value.isEmpty()) {
            out.add(name + ": " + value + ";");
        }
        for (Node child : attribute.getChildren()) {
            collectDeclarations((AttributeNode) child, name, out);
        }
    }

    private String renderComment(CommentNode comment, String indent) {
        StringBuilder sb = new StringBuilder(indent).append("/* ").append(comment.getText());
        for (SourceLine line : comment.getBodyLines()) {
            appendCommentLine(sb, line, indent);
        }
        return sb.append(" */").toString();
    }

    private static void appendCommentLine(StringBuilder sb, SourceLine line, String indent) {
        sb.append('\n').append(indent).append(" * ").append(line.text());
        for (SourceLine nested : line.children()) {
            appendCommentLine(sb, nested, indent);
        }
    }

    private String renderDirective(DirectiveNode directive) {
        if (!directive.hasChildren()) {
            return directive.getValue() + ";";
        }

        List<String> declarations = new ArrayList<>();
        List<String> rules = new ArrayList<>();
        for (Node child : directive.getChildren()) {
            if (child instanceof AttributeNode attribute) {
                collectDeclarations(attribute, null, declarations);
            } else if (child instanceof RuleNode rule) {
                renderRule(rule, List.of(), 1, rules);
            } else if (child instanceof CommentNode comment) {
                declarations.add(renderComment(comment, INDENT));
            }
        }

        StringBuilder sb = new StringBuilder(directive.getValue()).append(" {");
        for (String declaration : declarations) {
            sb.append('\n');
            if (!declaration.startsWith(INDENT)) {
                sb.append(INDENT);
            }
            sb.append(declaration);
        }
        for (String rule : rules) {
            sb.append('\n').append(style == OutputStyle.NESTED ? rule : indentLines(rule));
        }
        return sb.append(style == OutputStyle.NESTED ? " }" : "\n}").toString();
    }

    private static String indentLines(String text) {
        return INDENT + text.replace("\n", "\n" + INDENT);
    }

    private static SassSyntaxException error(String message, Node node) {
        SassSyntaxException e = new SassSyntaxException(message, node.getLine());
        e.addBacktraceEntry(node.getFilename());
        return e;
    }
}
