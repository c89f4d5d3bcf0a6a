package org.sasslite.cli;

import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.engine.SassEngine;
import org.sasslite.engine.SassOptions;
import org.sasslite.engine.SassOptions.AttributeSyntax;
import org.sasslite.engine.SassOptions.OutputStyle;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line compiler.
 *
 * <pre>
 * sass-lite [--style nested|expanded] [-I dir]... [--attribute-syntax normal|alternate] input.sass [output.css]
 * </pre>
 *
 * Without an output file the CSS is written to standard output.
 */
public final class SassCommandLine {

    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO_ERROR = 3;

    private final PrintStream out;
    private final PrintStream err;

    SassCommandLine(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new SassCommandLine(System.out, System.err).run(args));
    }

    int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage();
            return EXIT_USAGE;
        }

        String template;
        try {
            template = Files.readString(arguments.input(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + arguments.input() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        String css;
        try {
            css = new SassEngine(template, arguments.toOptions()).render();
        } catch (SassSyntaxException e) {
            reportSyntaxError(e, arguments.input().toString());
            return EXIT_SYNTAX_ERROR;
        }

        if (arguments.output() == null) {
            out.print(css);
            return EXIT_OK;
        }
        try {
            Files.writeString(arguments.output(), css, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot write " + arguments.output() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        out.println("Compiled " + arguments.input() + " -> " + arguments.output());
        return EXIT_OK;
    }

    private void reportSyntaxError(SassSyntaxException e, String input) {
        String file = e.getSassFilename() != null ? e.getSassFilename() : input;
        err.println("Syntax error on line " + e.getSassLine() + " of " + file + ": " + e.getMessage());
        List<String> chain = e.getImportChain();
        for (int i = 1; i < chain.size(); i++) {
            err.println("  imported from " + chain.get(i));
        }
    }

    private void printUsage() {
        err.println("Usage: sass-lite [--style nested|expanded] [-I dir]... "
                + "[--attribute-syntax normal|alternate] input.sass [output.css]");
    }

    /**
     * Parsed command-line arguments.
     */
    record Arguments(
            OutputStyle style,
            List<String> loadPaths,
            AttributeSyntax attributeSyntax,
            Path input,
            Path output) {

        static Arguments parse(String[] args) {
            OutputStyle style = OutputStyle.NESTED;
            List<String> loadPaths = new ArrayList<>();
            AttributeSyntax attributeSyntax = null;
            List<String> files = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--style" -> style = OutputStyle.fromName(value(args, ++i, arg));
                    case "-I", "--load-path" -> loadPaths.add(value(args, ++i, arg));
                    case "--attribute-syntax" -> attributeSyntax = AttributeSyntax.fromName(value(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        files.add(arg);
                    }
                }
            }

            if (files.isEmpty() || files.size() > 2) {
                throw new IllegalArgumentException("Expected an input file and an optional output file");
            }
            Path input = Path.of(files.get(0));
            Path output = files.size() == 2 ? Path.of(files.get(1)) : null;
            return new Arguments(style, loadPaths, attributeSyntax, input, output);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        SassOptions toOptions() {
            List<String> paths = new ArrayList<>(loadPaths);
            Path parent = input.toAbsolutePath().getParent();
            paths.add(parent == null ? "." : parent.toString());
            return SassOptions.defaults()
                    .withStyle(style)
                    .withLoadPaths(paths)
                    .withFilename(input.toString())
                    .withAttributeSyntax(attributeSyntax);
        }
    }
}
