package org.shellgo.compiler.ir;

/**
 * Helpers for IR values. An IR value is text in which {@code ${NAME}} (or {@code $NAME})
 * refers to a variable, {@code \$} and {@code \\} stand for a literal dollar sign and
 * backslash, and {@link #COMMAND_SUBSTITUTION} marks a command substitution that is
 * not evaluated.
 */
public final class IrValues {

    /** Opaque marker for {@code $(...)}. */
    public static final String COMMAND_SUBSTITUTION = "$(command)";

    private IrValues() {}

    /**
     * Escapes literal text so that it contains no references.
     * @param text The literal text.
     * @return The IR value.
     */
    public static String literal(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == '$') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * @param name A variable, positional or special parameter name.
     * @return A reference to it.
     */
    public static String reference(String name) {
        return "${" + name + "}";
    }

    /**
     * Returns the literal text of a value if it contains no references.
     * @param value The IR value.
     * @return The unescaped text, or {@code null} if the value interpolates anything.
     */
    public static String literalText(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && (value.charAt(i + 1) == '\\' || value.charAt(i + 1) == '$')) {
                sb.append(value.charAt(++i));
            } else if (c == '$') {
                return null;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
