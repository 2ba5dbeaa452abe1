package org.shellgo.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Words.
    /** A shell word; its value is the parsed word. */
    WORD,
    /** A descriptor number directly followed by a redirection operator, e.g. the {@code 2} in {@code 2>}. */
    IO_NUMBER,
    /** An arithmetic command or C-style for header {@code (( ... ))}. */
    ARITH_COMMAND,

    // Control operators.
    /** {@code |} */
    PIPE,
    /** {@code ||} */
    OR_IF,
    /** {@code &&} */
    AND_IF,
    /** {@code &} */
    AMP,
    /** {@code ;} */
    SEMI,
    /** {@code ;;} */
    DSEMI,
    /** {@code (} */
    LPAREN,
    /** {@code )} */
    RPAREN,

    // Redirection operators.
    /** {@code <} */
    LESS,
    /** {@code >} */
    GREAT,
    /** {@code >>} */
    DGREAT,
    /** {@code >|} */
    CLOBBER,
    /** {@code <&} */
    LESSAND,
    /** {@code >&} */
    GREATAND,
    /** {@code &>} */
    AND_GREAT,
    /** {@code &>>} */
    AND_DGREAT,
    /** {@code <<} */
    DLESS,
    /** {@code <<-} */
    DLESSDASH,
    /** {@code <<<} */
    TLESS,
    /** {@code <>} */
    LESSGREAT,

    // Structure.
    /** A line break. */
    NEWLINE,
    /** Marks the end of the script. */
    END_OF_FILE;

    /**
     * @return {@code true} for the redirection operators.
     */
    public boolean isRedirection() {
        return switch (this) {
            case LESS, GREAT, DGREAT, CLOBBER, LESSAND, GREATAND, AND_GREAT, AND_DGREAT,
                 DLESS, DLESSDASH, TLESS, LESSGREAT -> true;
            default -> false;
        };
    }
}
