package org.sasslite.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when a Sass document cannot be compiled.
 *
 * Carries the 1-based source line and, once the error has crossed a file
 * boundary, the file it came from plus the chain of files that imported it
 * (innermost first).
 */
public class SassSyntaxException extends RuntimeException {

    private int line;
    private String filename;
    private final List<String> importChain = new ArrayList<>();

    public SassSyntaxException(String message) {
        this(message, -1);
    }

    public SassSyntaxException(String message, int line) {
        super(message);
        this.line = line;
    }

    public SassSyntaxException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    public int getSassLine() {
        return line;
    }

    /**
     * Sets the line when the error was raised by code that had no line
     * information, such as the constant evaluator.
     */
    public void setSassLine(int line) {
        this.line = line;
    }

    public boolean hasLocation() {
        return line > 0;
    }

    /**
     * @return the file the error occurred in, or null for anonymous templates
     */
    public String getSassFilename() {
        return filename;
    }

    /**
     * @return files the error passed through, innermost first
     */
    public List<String> getImportChain() {
        return Collections.unmodifiableList(importChain);
    }

    /**
     * Records that the error propagated out of the given file. The first
     * entry also becomes the error's filename.
     */
    public void addBacktraceEntry(String file) {
        if (file == null) {
            return;
        }
        if (filename == null) {
            filename = file;
        }
        importChain.add(file);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Syntax error");
        if (hasLocation()) {
            sb.append(" on line ").append(line);
        }
        if (filename != null) {
            sb.append(" of ").append(filename);
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
