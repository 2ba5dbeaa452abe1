package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code while} or {@code until} loop.
 *
 * @param until {@code true} for {@code until}.
 * @param condition The condition statements.
 * @param body The loop body.
 * @param source The position of the keyword.
 */
public record WhileNode(boolean until, List<StatementNode> condition, List<StatementNode> body, SourceInfo source) implements AstNode {

    public WhileNode {
        condition = List.copyOf(condition);
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(condition);
        children.addAll(body);
        return children;
    }
}
