package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * A binary command list. Pipelines and and-or lists nest left-associatively:
 * {@code a | b | c} is {@code (a | b) | c}.
 *
 * @param op The operator joining both sides.
 * @param left The left operand.
 * @param right The right operand.
 * @param source The position of the left operand.
 */
public record BinaryNode(Op op, StatementNode left, StatementNode right, SourceInfo source) implements AstNode {

    /**
     * Binary command operators.
     */
    public enum Op {
        /** {@code |} */
        PIPE,
        /** {@code &&} */
        AND,
        /** {@code ||} */
        OR
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
