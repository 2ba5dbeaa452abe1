package org.shellgo.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of a parsed script: its top-level statements in source order.
 *
 * @param fileName The logical name of the script.
 * @param statements The top-level statements.
 */
public record ScriptNode(String fileName, List<StatementNode> statements) implements AstNode {

    public ScriptNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }
}
