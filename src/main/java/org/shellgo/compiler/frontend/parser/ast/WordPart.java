package org.shellgo.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The parts a {@link WordNode} is made of.
 */
public sealed interface WordPart permits WordPart.Literal, WordPart.SingleQuoted, WordPart.DoubleQuoted,
        WordPart.Parameter, WordPart.CommandSubstitution, WordPart.Arithmetic {

    /**
     * Unquoted literal text, with backslash escapes already removed.
     * @param text The literal characters.
     */
    record Literal(String text) implements WordPart {}

    /**
     * {@code 'text'}; the content is taken verbatim.
     * @param text The characters between the quotes.
     */
    record SingleQuoted(String text) implements WordPart {}

    /**
     * {@code "..."}; may contain literals, parameters and substitutions.
     * @param parts The inner parts.
     */
    record DoubleQuoted(List<WordPart> parts) implements WordPart {
        public DoubleQuoted {
            parts = List.copyOf(parts);
        }
    }

    /**
     * A parameter expansion: {@code $NAME}, {@code ${NAME}}, {@code $1}, {@code $@}, ...
     *
     * @param name The parameter name, number or special character.
     * @param braced Whether braces were used.
     * @param operator Anything after the name inside the braces (e.g. {@code :-default}), or empty.
     */
    record Parameter(String name, boolean braced, String operator) implements WordPart {

        /**
         * @return {@code true} for positional parameters such as {@code $1}.
         */
        public boolean isPositional() {
            return !name.isEmpty() && name.chars().allMatch(Character::isDigit);
        }

        /**
         * @return {@code true} for special parameters such as {@code $@} or {@code $?}.
         */
        public boolean isSpecial() {
            return name.length() == 1 && "@*#?$!-".indexOf(name.charAt(0)) >= 0;
        }
    }

    /**
     * {@code $(...)} or a backquoted command; kept as raw text.
     * @param source The command text.
     */
    record CommandSubstitution(String source) implements WordPart {}

    /**
     * {@code $((...))}; kept as raw text.
     * @param expression The arithmetic expression.
     */
    record Arithmetic(String expression) implements WordPart {}
}
