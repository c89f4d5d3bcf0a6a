package org.sasslite.dsl.tree;

import java.util.Objects;

/**
 * An @-rule that is passed to the output as written, e.g.
 * {@code @import url(print.css)} or {@code @charset "utf-8"}.
 */
public final class DirectiveNode extends Node {

    private final String value;

    public DirectiveNode(String value) {
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "Directive(" + value + ")" + getChildren();
    }
}
