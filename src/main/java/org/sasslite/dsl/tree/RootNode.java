package org.sasslite.dsl.tree;

/**
 * The document itself. Accepts any node as a child; attributes are only
 * rejected when the tree is rendered.
 */
public final class RootNode extends Node {

    @Override
    public String toString() {
        return "Root" + getChildren();
    }
}
