package org.shellgo.compiler.backend.emit;

import java.util.ArrayList;
import java.util.List;

/**
 * A Go expression that may span several lines (an immediately invoked closure).
 * Lines after the first carry their indentation relative to the line the
 * expression starts on.
 *
 * @param lines The expression text, at least one line.
 */
public record GoExpr(List<String> lines) {

    public GoExpr {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("An expression needs at least one line.");
        }
        lines = List.copyOf(lines);
    }

    /**
     * @param text A single-line expression.
     * @return The expression.
     */
    public static GoExpr of(String text) {
        return new GoExpr(List.of(text));
    }

    /**
     * Wraps statement lines into an immediately invoked closure.
     * @param header The opening line, e.g. {@code func() bool {}.
     * @param body The body lines, already indented one level.
     * @param footer The closing line, e.g. <code>}()</code>.
     * @return The expression.
     */
    public static GoExpr closure(String header, List<String> body, String footer) {
        List<String> all = new ArrayList<>();
        all.add(header);
        all.addAll(body);
        all.add(footer);
        return new GoExpr(all);
    }

    /**
     * @return {@code true} if the expression fits on one line.
     */
    public boolean isSimple() {
        return lines.size() == 1;
    }

    /**
     * @return The text of a single-line expression.
     */
    public String text() {
        if (!isSimple()) {
            throw new IllegalStateException("Multi-line expression has no single-line text.");
        }
        return lines.get(0);
    }

    /**
     * @return The logical negation.
     */
    public GoExpr not() {
        if (isSimple() && (text().equals("true") || text().equals("false"))) {
            return of(text().equals("true") ? "false" : "true");
        }
        return wrap("!(", ")");
    }

    public GoExpr and(GoExpr other) {
        return combine(" && ", other);
    }

    public GoExpr or(GoExpr other) {
        return combine(" || ", other);
    }

    /**
     * @param prefix Text placed before the first line.
     * @param suffix Text placed after the last line.
     * @return The wrapped expression.
     */
    public GoExpr wrap(String prefix, String suffix) {
        List<String> all = new ArrayList<>(lines);
        all.set(0, prefix + all.get(0));
        int last = all.size() - 1;
        all.set(last, all.get(last) + suffix);
        return new GoExpr(all);
    }

    private GoExpr combine(String operator, GoExpr other) {
        List<String> all = new ArrayList<>(lines);
        int last = all.size() - 1;
        all.set(last, all.get(last) + operator + other.lines.get(0));
        all.addAll(other.lines.subList(1, other.lines.size()));
        return new GoExpr(all).wrap("(", ")");
    }
}
