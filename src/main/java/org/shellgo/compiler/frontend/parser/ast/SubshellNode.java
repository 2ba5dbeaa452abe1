package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A subshell {@code ( list )}.
 *
 * @param statements The statements run in the subshell.
 * @param source The position of the opening parenthesis.
 */
public record SubshellNode(List<StatementNode> statements, SourceInfo source) implements AstNode {

    public SubshellNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }
}
