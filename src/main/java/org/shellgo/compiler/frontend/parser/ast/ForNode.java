package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code for NAME [in WORDS]} loop.
 *
 * @param variable The loop variable.
 * @param items The item words; empty when {@code hasInClause} is false.
 * @param hasInClause Whether an {@code in} list was written (otherwise the positional parameters are iterated).
 * @param body The loop body.
 * @param source The position of the keyword.
 */
public record ForNode(String variable, List<WordNode> items, boolean hasInClause, List<StatementNode> body, SourceInfo source) implements AstNode {

    public ForNode {
        items = List.copyOf(items);
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(items);
        children.addAll(body);
        return children;
    }
}
