package org.sasslite.engine;

import org.sasslite.css.CssRenderer;
import org.sasslite.dsl.IndentationTokenizer;
import org.sasslite.dsl.LineTreeBuilder;
import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.dsl.SourceLine;
import org.sasslite.dsl.tree.RootNode;
import org.sasslite.script.ConstantEvaluator;
import org.sasslite.script.ScriptEvaluator;
import org.sasslite.symbols.ConstantTable;
import org.sasslite.symbols.MixinTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles one Sass template.
 *
 * <pre>
 * SassEngine engine = new SassEngine(template, SassOptions.defaults().withFilename("main.sass"));
 * String css = engine.render();
 * </pre>
 *
 * Each engine owns its constant and mixin tables. An import builds a nested
 * engine over the imported file, hands it copies of the current tables and
 * takes the nested engine's tables back once it is done.
 */
public class SassEngine {

    private final String template;
    private final SassOptions options;
    private final ConstantEvaluator evaluator;
    private final SourceFileSystem fileSystem;
    private final List<String> importStack;

    private ConstantTable constants = ConstantTable.withDefaults();
    private MixinTable mixins = MixinTable.empty();

    public SassEngine(String template) {
        this(template, SassOptions.defaults());
    }

    public SassEngine(String template, SassOptions options) {
        this(template, options, new ScriptEvaluator(), new LocalFileSystem());
    }

    public SassEngine(String template, SassOptions options, ConstantEvaluator evaluator, SourceFileSystem fileSystem) {
        this(template, options, evaluator, fileSystem, options.filename() == null ? List.of() : List.of(options.filename()));
    }

    private SassEngine(String template, SassOptions options, ConstantEvaluator evaluator,
            SourceFileSystem fileSystem, List<String> importStack) {
        this.template = Objects.requireNonNull(template, "Template cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.fileSystem = Objects.requireNonNull(fileSystem, "File system cannot be null");
        this.importStack = List.copyOf(importStack);
    }

    /**
     * Compiles the template to CSS.
     *
     * @throws SassSyntaxException if the template or one of its imports is invalid
     */
    public String render() {
        RootNode root = renderToTree();
        return new CssRenderer(options.style()).render(root);
    }

    /**
     * Compiles the template to a node tree without rendering it.
     *
     * @throws SassSyntaxException if the template or one of its imports is invalid
     */
    public RootNode renderToTree() {
        try {
            return buildTree();
        } catch (SassSyntaxException e) {
            e.addBacktraceEntry(options.filename());
            throw e;
        }
    }

    RootNode buildTree() {
        List<SourceLine> lines = LineTreeBuilder.build(IndentationTokenizer.tokenize(template));
        return new TreeAssembler(this, new ImportResolver(this)).assemble(lines);
    }

    public SassOptions options() {
        return options;
    }

    /**
     * @return a copy of the constants defined so far
     */
    public ConstantTable getConstants() {
        return constants.copy();
    }

    /**
     * @return a copy of the mixins defined so far
     */
    public MixinTable getMixins() {
        return mixins.copy();
    }

    ConstantTable constants() {
        return constants;
    }

    MixinTable mixins() {
        return mixins;
    }

    ConstantEvaluator evaluator() {
        return evaluator;
    }

    SourceFileSystem fileSystem() {
        return fileSystem;
    }

    /**
     * @return files currently being compiled, outermost first
     */
    List<String> importStack() {
        return importStack;
    }

    SassEngine nestedEngine(String source, String path) {
        List<String> stack = new ArrayList<>(importStack);
        stack.add(path);
        return new SassEngine(source, options.withFilename(path), evaluator, fileSystem, stack);
    }

    /**
     * Gives this engine everything the importer has defined so far. The
     * importer's definitions win over this engine's defaults.
     */
    void seedTables(SassEngine importer) {
        constants.putAll(importer.constants);
        mixins.putAll(importer.mixins);
    }

    /**
     * Continues with the tables of a finished import.
     */
    void adoptTables(SassEngine imported) {
        this.constants = imported.constants;
        this.mixins = imported.mixins;
    }
}
