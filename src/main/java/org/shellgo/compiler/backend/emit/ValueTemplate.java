package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.ir.IrValues;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an IR value into literal text and variable references.
 * <p>
 * References are {@code ${NAME}} or {@code $NAME}, where a name starts with a letter
 * or underscore and continues with letters, digits or underscores; positional
 * ({@code $1}) and the special parameters {@code @ * #} are accepted as well.
 */
public final class ValueTemplate {

    /**
     * A piece of an IR value.
     */
    public sealed interface Segment permits Text, Reference {}

    /**
     * Literal text.
     * @param text The unescaped text.
     */
    public record Text(String text) implements Segment {}

    /**
     * A reference to a variable or parameter.
     * @param name The referenced name.
     */
    public record Reference(String name) implements Segment {}

    private ValueTemplate() {}

    /**
     * Parses an IR value. Adjacent literal text is merged into one segment.
     * @param value The IR value.
     * @return The segments in order; empty for the empty value.
     */
    public static List<Segment> parse(String value) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && (value.charAt(i + 1) == '\\' || value.charAt(i + 1) == '$')) {
                text.append(value.charAt(i + 1));
                i += 2;
            } else if (c == '$' && value.startsWith(IrValues.COMMAND_SUBSTITUTION, i)) {
                text.append(IrValues.COMMAND_SUBSTITUTION);
                i += IrValues.COMMAND_SUBSTITUTION.length();
            } else if (c == '$' && i + 1 < value.length() && value.charAt(i + 1) == '{') {
                int close = value.indexOf('}', i + 2);
                String name = close < 0 ? null : value.substring(i + 2, close);
                if (name != null && isReferenceName(name)) {
                    flush(text, segments);
                    segments.add(new Reference(name));
                    i = close + 1;
                } else {
                    text.append(c);
                    i++;
                }
            } else if (c == '$' && i + 1 < value.length()) {
                int end = scanName(value, i + 1);
                if (end > i + 1) {
                    flush(text, segments);
                    segments.add(new Reference(value.substring(i + 1, end)));
                    i = end;
                } else {
                    text.append(c);
                    i++;
                }
            } else {
                text.append(c);
                i++;
            }
        }
        flush(text, segments);
        return segments;
    }

    private static int scanName(String value, int start) {
        char first = value.charAt(start);
        if (isNameStart(first)) {
            int end = start + 1;
            while (end < value.length() && isNameChar(value.charAt(end))) end++;
            return end;
        }
        if ((first >= '0' && first <= '9') || first == '@' || first == '*' || first == '#') {
            return start + 1;
        }
        return start;
    }

    private static boolean isReferenceName(String name) {
        if (name.isEmpty()) return false;
        if (name.equals("@") || name.equals("*") || name.equals("#")) return true;
        if (name.chars().allMatch(ch -> ch >= '0' && ch <= '9')) return true;
        if (!isNameStart(name.charAt(0))) return false;
        return name.chars().allMatch(ch -> isNameChar((char) ch));
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    private static void flush(StringBuilder text, List<Segment> segments) {
        if (text.length() > 0) {
            segments.add(new Text(text.toString()));
            text.setLength(0);
        }
    }
}
