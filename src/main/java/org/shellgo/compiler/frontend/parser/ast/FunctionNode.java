package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * A function definition {@code name() body} or {@code function name body}.
 *
 * @param name The function name.
 * @param body The body statement (usually a {@link BlockNode}).
 * @param source The position of the name.
 */
public record FunctionNode(String name, StatementNode body, SourceInfo source) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }
}
