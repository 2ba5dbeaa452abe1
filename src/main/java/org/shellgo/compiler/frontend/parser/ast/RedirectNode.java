package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * A redirection attached to a statement.
 *
 * @param op The redirection operator.
 * @param fd The explicit file descriptor written before the operator, or {@code null}.
 * @param target The target word (file name, descriptor or here-document delimiter).
 * @param hereDocument The here-document body for {@link Op#HEREDOC}, otherwise {@code null}.
 * @param source The position of the operator.
 */
public record RedirectNode(Op op, Integer fd, WordNode target, String hereDocument, SourceInfo source) implements AstNode {

    /**
     * Redirection operators recognised by the front end.
     */
    public enum Op {
        /** {@code >} */
        OUTPUT(">"),
        /** {@code >>} */
        APPEND(">>"),
        /** {@code <} */
        INPUT("<"),
        /** {@code >|} */
        CLOBBER(">|"),
        /** {@code >&} */
        DUP_OUTPUT(">&"),
        /** {@code <&} */
        DUP_INPUT("<&"),
        /** {@code &>} */
        OUTPUT_AND_ERROR("&>"),
        /** {@code &>>} */
        APPEND_AND_ERROR("&>>"),
        /** {@code <<} and {@code <<-} */
        HEREDOC("<<"),
        /** {@code <<<} */
        HERESTRING("<<<"),
        /** {@code <>} */
        READ_WRITE("<>");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target);
    }
}
