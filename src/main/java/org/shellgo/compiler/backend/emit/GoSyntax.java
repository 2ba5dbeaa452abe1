package org.shellgo.compiler.backend.emit;

/**
 * Lexical helpers for writing Go source.
 */
public final class GoSyntax {

    private GoSyntax() {}

    /**
     * Quotes text as an interpreted Go string literal.
     * @param text The raw text.
     * @return The literal including the surrounding double quotes.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * @param name A shell variable name.
     * @return The Go identifier holding it.
     */
    public static String variable(String name) {
        return "v_" + sanitize(name);
    }

    /**
     * @param name A shell function name.
     * @return The Go function implementing it.
     */
    public static String function(String name) {
        return "fn_" + sanitize(name);
    }

    private static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(valid ? c : '_');
        }
        return sb.toString();
    }
}
