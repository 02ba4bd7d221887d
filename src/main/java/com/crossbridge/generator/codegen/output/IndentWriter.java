package com.crossbridge.generator.codegen.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Line-oriented writer for generated source. Indentation is applied when the first text of a
 * line is written, so blank lines never carry trailing whitespace.
 */
public class IndentWriter {

    public static final String DEFAULT_INDENT = "    ";

    private final Writer out;
    private final String indent;

    private String currentIndent = "";
    private boolean startOfLine = true;

    public IndentWriter(Writer out) {
        this(out, DEFAULT_INDENT);
    }

    public IndentWriter(Writer out, String indent) {
        this.out = out;
        this.indent = indent;
    }

    /**
     * Writes text without ending the line.
     */
    public IndentWriter w(String s) {
        if (s.isEmpty()) {
            return this;
        }
        if (startOfLine) {
            raw(currentIndent);
            startOfLine = false;
        }
        raw(s);
        return this;
    }

    /**
     * Writes text and ends the line.
     */
    public IndentWriter wl(String s) {
        w(s);
        return wl();
    }

    /**
     * Ends the current line.
     */
    public IndentWriter wl() {
        raw("\n");
        startOfLine = true;
        return this;
    }

    /**
     * Writes a line one level to the left of the current indentation, e.g. access labels.
     */
    public IndentWriter wlOutdent(String s) {
        String saved = currentIndent;
        currentIndent = currentIndent.length() >= indent.length()
                ? currentIndent.substring(indent.length())
                : "";
        try {
            return wl(s);
        } finally {
            currentIndent = saved;
        }
    }

    public IndentWriter nested(Runnable body) {
        return nestedN(1, body);
    }

    public IndentWriter nestedN(int levels, Runnable body) {
        String saved = currentIndent;
        currentIndent = currentIndent + indent.repeat(levels);
        try {
            body.run();
        } finally {
            currentIndent = saved;
        }
        return this;
    }

    /**
     * Writes {@code {}, the nested body, and {@code }} on its own line.
     */
    public IndentWriter braced(Runnable body) {
        wl("{");
        nested(body);
        return wl("}");
    }

    public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void raw(String s) {
        try {
            out.write(s);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
