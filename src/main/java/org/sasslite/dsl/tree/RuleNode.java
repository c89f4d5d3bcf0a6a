package org.sasslite.dsl.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A selector line such as {@code #main p, #main ul}.
 *
 * A rule whose text ends in a comma is continued: the next sibling line
 * carries more selectors for the same block and the two are merged with
 * {@link #addRules(RuleNode)}.
 */
public final class RuleNode extends Node {

    private final List<String> rules = new ArrayList<>();

    public RuleNode(String rule) {
        Objects.requireNonNull(rule, "Rule cannot be null");
        rules.add(rule);
    }

    /**
     * @return the raw selector lines, one entry per merged line
     */
    public List<String> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * @return every selector of this rule, trimmed, in source order
     */
    public List<String> getSelectors() {
        return rules.stream()
                .flatMap(rule -> Arrays.stream(rule.split(",")))
                .map(String::strip)
                .filter(selector -> !selector.isEmpty())
                .toList();
    }

    /**
     * @return the selectors joined as they appear in CSS
     */
    public String getSelector() {
        return getSelectors().stream().collect(Collectors.joining(", "));
    }

    public boolean isContinued() {
        return rules.get(rules.size() - 1).endsWith(",");
    }

    public void addRules(RuleNode other) {
        rules.addAll(other.rules);
    }

    @Override
    public String toString() {
        return "Rule(" + getSelector() + ")" + getChildren();
    }
}
