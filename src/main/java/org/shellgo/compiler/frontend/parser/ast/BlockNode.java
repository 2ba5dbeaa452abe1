package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A command group {@code { list; }} run in the current shell.
 *
 * @param statements The grouped statements.
 * @param source The position of the opening brace.
 */
public record BlockNode(List<StatementNode> statements, SourceInfo source) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }
}
