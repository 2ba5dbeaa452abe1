package org.shellgo.compiler.backend.emit;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates Go source lines with tab indentation.
 */
public final class CodeBuilder {

    private final List<String> lines = new ArrayList<>();
    private int indent;

    public CodeBuilder() {
        this(0);
    }

    /**
     * @param indent The initial indentation level.
     */
    public CodeBuilder(int indent) {
        this.indent = indent;
    }

    /**
     * Writes one line at the current indentation. Empty text produces an empty line.
     * @param text The line.
     * @return This builder.
     */
    public CodeBuilder line(String text) {
        lines.add(text.isEmpty() ? "" : "\t".repeat(indent) + text);
        return this;
    }

    /**
     * Writes a line that opens a block and indents the following lines.
     * @param text The line, usually ending with <code>{</code>.
     * @return This builder.
     */
    public CodeBuilder open(String text) {
        line(text);
        indent++;
        return this;
    }

    /**
     * Outdents and writes the line that closes a block.
     * @param text The line, usually <code>}</code>.
     * @return This builder.
     */
    public CodeBuilder close(String text) {
        indent--;
        if (indent < 0) {
            throw new IllegalStateException("Unbalanced block close: " + text);
        }
        return line(text);
    }

    /**
     * Writes a possibly multi-line expression framed by a prefix and a suffix.
     * @param prefix Text before the expression, e.g. {@code "if "}.
     * @param expr The expression.
     * @param suffix Text after the expression, e.g. <code>" {"</code>.
     * @return This builder.
     */
    public CodeBuilder expression(String prefix, GoExpr expr, String suffix) {
        List<String> exprLines = expr.wrap(prefix, suffix).lines();
        for (String exprLine : exprLines) {
            line(exprLine);
        }
        return this;
    }

    /**
     * Writes {@code expression(prefix, expr, suffix)} and indents the following lines.
     * @param prefix Text before the expression.
     * @param expr The expression.
     * @param suffix Text after the expression, usually ending with <code>{</code>.
     * @return This builder.
     */
    public CodeBuilder openExpression(String prefix, GoExpr expr, String suffix) {
        expression(prefix, expr, suffix);
        indent++;
        return this;
    }

    /**
     * Closes the current block and opens the next one on the same line, e.g. <code>} else {</code>.
     * @param text The line.
     * @return This builder.
     */
    public CodeBuilder reopen(String text) {
        close(text);
        indent++;
        return this;
    }

    /**
     * Closes the current block and opens one headed by an expression, e.g. <code>} else if x {</code>.
     * @param prefix Text before the expression.
     * @param expr The expression.
     * @param suffix Text after the expression.
     * @return This builder.
     */
    public CodeBuilder reopenExpression(String prefix, GoExpr expr, String suffix) {
        indent--;
        if (indent < 0) {
            throw new IllegalStateException("Unbalanced block reopen: " + prefix);
        }
        return openExpression(prefix, expr, suffix);
    }

    /**
     * Writes an empty line unless the previous line is already empty.
     * @return This builder.
     */
    public CodeBuilder blank() {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
        return this;
    }

    /**
     * @return The current indentation level.
     */
    public int indent() {
        return indent;
    }

    /**
     * @return The written lines.
     */
    public List<String> lines() {
        return List.copyOf(lines);
    }

    @Override
    public String toString() {
        return String.join("\n", lines) + "\n";
    }
}
