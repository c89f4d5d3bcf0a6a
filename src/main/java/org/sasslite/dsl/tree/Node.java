package org.sasslite.dsl.tree;

import org.sasslite.dsl.SassSyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base class of the compiled document tree.
 *
 * Type hierarchy:
 * Node
 * ├── RootNode (the document)
 * ├── RuleNode (selectors)
 * ├── AttributeNode (name and value)
 * ├── CommentNode (CSS comment kept in the output)
 * └── DirectiveNode (@-rules passed through)
 */
public abstract sealed class Node
        permits RootNode, RuleNode, AttributeNode, CommentNode, DirectiveNode {

    private int line = -1;
    private String filename;
    private final List<Node> children = new ArrayList<>();

    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    /**
     * @return the file this node was compiled from, or null for anonymous templates
     */
    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Appends a child.
     *
     * @throws SassSyntaxException if this node cannot contain the child
     */
    public void add(Node child) {
        Optional<String> invalid = invalidChild(child);
        if (invalid.isPresent()) {
            throw new SassSyntaxException(invalid.get(), child.getLine());
        }
        children.add(child);
    }

    /**
     * Replaces all children, used when a continued rule takes over the
     * children of the rule that closes it.
     */
    public void setChildren(List<Node> nodes) {
        children.clear();
        nodes.forEach(this::add);
    }

    /**
     * @return an error message if the child may not be nested here
     */
    protected Optional<String> invalidChild(Node child) {
        return Optional.empty();
    }
}
