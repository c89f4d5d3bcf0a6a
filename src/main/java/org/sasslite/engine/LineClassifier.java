package org.sasslite.engine;

import org.sasslite.dsl.LineShape;
import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.dsl.SourceLine;
import org.sasslite.dsl.tree.AttributeNode;
import org.sasslite.dsl.tree.CommentNode;
import org.sasslite.dsl.tree.DirectiveNode;
import org.sasslite.dsl.tree.Node;
import org.sasslite.dsl.tree.RuleNode;
import org.sasslite.engine.ClassifiedLine.Expansion;
import org.sasslite.engine.ClassifiedLine.ExpansionKind;
import org.sasslite.engine.ClassifiedLine.Marker;
import org.sasslite.engine.ClassifiedLine.MarkerKind;
import org.sasslite.engine.ClassifiedLine.Single;
import org.sasslite.engine.SassOptions.AttributeSyntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one logical line into a node, a marker or a list of expanded nodes.
 *
 * Dispatch is on the {@link LineShape} of the line. Constants and mixins are
 * recorded in the owning engine's tables as a side effect; imports and mixin
 * inclusions are expanded here.
 */
final class LineClassifier {

    /** {@code :name value} or {@code :name = expression} */
    private static final Pattern ATTRIBUTE = Pattern.compile("^:([^\\s=:]+)\\s*(=?)(?:\\s+|$)(.*)");

    /** {@code name: value} or {@code name = expression} */
    private static final Pattern ATTRIBUTE_ALTERNATE = Pattern.compile("^([^\\s=:]+)(\\s*=|:)(?:\\s+|$)(.*)");

    /** {@code !name = expression} or {@code !name ||= expression} */
    private static final Pattern CONSTANT = Pattern.compile("^!([^\\s()+\\-*/%!\"\\\\=]+)\\s*((?:\\|\\|)?=)\\s*(.+)");

    /** Imports that are plain CSS and must not be resolved. */
    private static final Pattern CSS_IMPORT = Pattern.compile("^(url\\(|\")");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final char SCRIPT_CHAR = '=';
    private static final String CONDITIONAL_ASSIGN = "||=";

    private final SassEngine engine;
    private final TreeAssembler assembler;
    private final ImportResolver importResolver;
    private final Deque<String> expandingMixins = new ArrayDeque<>();

    LineClassifier(SassEngine engine, TreeAssembler assembler, ImportResolver importResolver) {
        this.engine = engine;
        this.assembler = assembler;
        this.importResolver = importResolver;
    }

    ClassifiedLine classify(SourceLine line) {
        String text = line.text();
        return switch (LineShape.of(text)) {
            case ATTRIBUTE -> single(parseAttribute(line, ATTRIBUTE, AttributeSyntax.NORMAL));
            case ALTERNATE_ATTRIBUTE -> single(parseAttribute(line, ATTRIBUTE_ALTERNATE, AttributeSyntax.ALTERNATE));
            case CONSTANT -> parseConstant(line);
            case SILENT_COMMENT -> new Marker(MarkerKind.SILENT_COMMENT);
            case CSS_COMMENT -> single(new CommentNode(text));
            case DIRECTIVE -> parseDirective(line);
            case ESCAPED_RULE -> single(new RuleNode(text.substring(1)));
            case MIXIN_DEFINITION -> defineMixin(line);
            case MIXIN_INCLUDE -> includeMixin(line);
            case RULE -> single(new RuleNode(text));
        };
    }

    private static ClassifiedLine single(Node node) {
        return new Single(node);
    }

    private AttributeNode parseAttribute(SourceLine line, Pattern pattern, AttributeSyntax syntax) {
        AttributeSyntax allowed = engine.options().attributeSyntax();
        if (allowed != null && allowed != syntax) {
            throw new SassSyntaxException("Illegal attribute syntax: can't use "
                    + describe(syntax) + " syntax when attribute syntax is " + describe(allowed) + ".",
                    line.lineNumber());
        }

        Matcher m = pattern.matcher(line.text());
        if (!m.find()) {
            throw new SassSyntaxException("Invalid attribute: \"" + line.text() + "\".", line.lineNumber());
        }

        String name = m.group(1);
        String operator = m.group(2).strip();
        String value = m.group(3);
        if (!operator.isEmpty() && operator.charAt(0) == SCRIPT_CHAR) {
            value = engine.evaluator().evaluate(value, engine.constants(), line.lineNumber());
        }
        return new AttributeNode(name, value);
    }

    private static String describe(AttributeSyntax syntax) {
        return syntax.name().toLowerCase();
    }

    private ClassifiedLine parseConstant(SourceLine line) {
        Matcher m = CONSTANT.matcher(line.text());
        if (!m.find()) {
            throw new SassSyntaxException("Invalid constant: \"" + line.text() + "\".", line.lineNumber());
        }

        String name = m.group(1);
        String value = engine.evaluator().evaluate(m.group(3), engine.constants(), line.lineNumber());
        if (CONDITIONAL_ASSIGN.equals(m.group(2))) {
            engine.constants().setIfAbsent(name, value);
        } else {
            engine.constants().set(name, value);
        }
        return new Marker(MarkerKind.CONSTANT);
    }

    private ClassifiedLine parseDirective(SourceLine line) {
        String[] parts = WHITESPACE.split(line.text().substring(1), 2);
        String directive = parts[0];
        String value = parts.length > 1 ? parts[1] : null;

        if (!"import".equals(directive)) {
            return single(new DirectiveNode(line.text()));
        }
        if (value == null) {
            throw new SassSyntaxException("Invalid import directive: \"" + line.text() + "\".", line.lineNumber());
        }
        if (CSS_IMPORT.matcher(value).find()) {
            return single(new DirectiveNode(line.text()));
        }
        return new Expansion(ExpansionKind.IMPORT, importResolver.importFiles(value, line.lineNumber()));
    }

    private ClassifiedLine defineMixin(SourceLine line) {
        String name = line.text().substring(1);
        if (name.isBlank()) {
            throw new SassSyntaxException("Invalid mixin definition: \"" + line.text() + "\".", line.lineNumber());
        }
        engine.mixins().define(name, line.children());
        return new Marker(MarkerKind.MIXIN);
    }

    private ClassifiedLine includeMixin(SourceLine line) {
        String name = line.text().substring(1);
        List<SourceLine> body = engine.mixins().include(name, line.lineNumber());
        if (expandingMixins.contains(name)) {
            throw new SassSyntaxException("Recursive mixin inclusion: '" + name + "'.", line.lineNumber());
        }

        expandingMixins.push(name);
        try {
            return new Expansion(ExpansionKind.MIXIN_INCLUDE, assembler.assembleDetached(body));
        } finally {
            expandingMixins.pop();
        }
    }
}
