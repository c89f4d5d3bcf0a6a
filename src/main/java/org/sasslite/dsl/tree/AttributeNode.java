package org.sasslite.dsl.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * A CSS property. Nested attributes form a namespace:
 * {@code :font} with a child {@code :family arial} renders as
 * {@code font-family: arial}.
 */
public final class AttributeNode extends Node {

    private final String name;
    private final String value;

    public AttributeNode(String name, String value) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public String getName() {
        return name;
    }

    /**
     * @return the resolved value, empty for a namespace-only attribute
     */
    public String getValue() {
        return value;
    }

    @Override
    protected Optional<String> invalidChild(Node child) {
        if (!(child instanceof AttributeNode)) {
            return Optional.of("Illegal nesting: Only attributes may be nested beneath attributes.");
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Attribute(" + name + ": " + value + ")" + getChildren();
    }
}
