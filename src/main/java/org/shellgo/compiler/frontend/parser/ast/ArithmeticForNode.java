package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A C-style {@code for ((init; cond; post))} loop. The header is kept as raw text.
 *
 * @param header The text between the double parentheses.
 * @param body The loop body.
 * @param source The position of the keyword.
 */
public record ArithmeticForNode(String header, List<StatementNode> body, SourceInfo source) implements AstNode {

    public ArithmeticForNode {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(body);
    }
}
