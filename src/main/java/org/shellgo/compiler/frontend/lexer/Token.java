package org.shellgo.compiler.frontend.lexer;

/**
 * Represents a single token extracted from a shell script by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., word, operator, newline).
 * @param text The exact text of the token from the script.
 * @param value The processed value of the token: the parsed
 *              {@link org.shellgo.compiler.frontend.parser.ast.WordNode} for words, the descriptor
 *              number for {@link TokenType#IO_NUMBER}, the expression for
 *              {@link TokenType#ARITH_COMMAND} or the body of a here-document operator.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the script the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Returns a copy of this token carrying a different value.
     * @param newValue The value to attach.
     * @return The new token.
     */
    public Token withValue(Object newValue) {
        return new Token(type, text, newValue, line, column, fileName);
    }
}
