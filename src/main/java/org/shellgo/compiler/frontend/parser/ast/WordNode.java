package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * A shell word made of adjacent parts, e.g. {@code pre"$X"'post'}.
 *
 * @param parts The parts in source order.
 * @param source The position of the first character.
 */
public record WordNode(List<WordPart> parts, SourceInfo source) implements AstNode {

    public WordNode {
        parts = List.copyOf(parts);
    }

    /**
     * Returns the text of the word if it consists of a single unquoted literal.
     * Reserved words and operators-as-words (e.g. {@code then}, {@code {}) are only
     * recognised in this form.
     *
     * @return The literal text, or {@code null} if the word contains quotes or expansions.
     */
    public String plainLiteral() {
        if (parts.size() == 1 && parts.get(0) instanceof WordPart.Literal literal) {
            return literal.text();
        }
        return null;
    }

    /**
     * @param text The text to compare.
     * @return {@code true} if this word is exactly the given unquoted literal.
     */
    public boolean isPlainLiteral(String text) {
        return text.equals(plainLiteral());
    }
}
