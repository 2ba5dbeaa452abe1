package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.backend.emit.ValueTemplate.Reference;
import org.shellgo.compiler.backend.emit.ValueTemplate.Segment;
import org.shellgo.compiler.backend.emit.ValueTemplate.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns IR values into Go string concatenations, putting resolved variable
 * references in place of {@code $NAME} and {@code ${NAME}} and keeping the
 * surrounding text as adjacent string literals.
 */
public final class VariableSplicer {

    private VariableSplicer() {}

    /**
     * @param value An IR value.
     * @param ctx The context resolving references.
     * @return A Go string expression; {@code ""} for the empty value.
     */
    public static String splice(String value, EmitContext ctx) {
        return render(ValueTemplate.parse(value), ctx);
    }

    /**
     * Splices several values joined by single spaces, as {@code echo} prints its arguments.
     * Adjacent literal text across values is merged into one literal.
     *
     * @param values IR values.
     * @param ctx The context resolving references.
     * @return A Go string expression; {@code ""} if there are no values.
     */
    public static String join(List<String> values, EmitContext ctx) {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                append(segments, new Text(" "));
            }
            for (Segment segment : ValueTemplate.parse(values.get(i))) {
                append(segments, segment);
            }
        }
        return render(segments, ctx);
    }

    private static void append(List<Segment> segments, Segment segment) {
        int last = segments.size() - 1;
        if (segment instanceof Text text && last >= 0 && segments.get(last) instanceof Text previous) {
            segments.set(last, new Text(previous.text() + text.text()));
        } else {
            segments.add(segment);
        }
    }

    private static String render(List<Segment> segments, EmitContext ctx) {
        if (segments.isEmpty()) {
            return "\"\"";
        }
        List<String> operands = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            if (segment instanceof Text text) {
                operands.add(GoSyntax.quote(text.text()));
            } else if (segment instanceof Reference reference) {
                operands.add(ctx.resolve(reference.name()));
            }
        }
        return String.join(" + ", operands);
    }
}
