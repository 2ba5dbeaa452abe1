package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code if} clause. An {@code elif} is represented as a nested {@link IfNode}
 * in the else position; a final {@code else} is a nested node with an empty
 * condition.
 *
 * @param condition The condition statements (empty for a plain {@code else}).
 * @param thenBranch The statements run when the condition succeeds.
 * @param elseBranch The nested {@code elif}/{@code else} clause, or {@code null}.
 * @param source The position of the keyword.
 */
public record IfNode(
        List<StatementNode> condition,
        List<StatementNode> thenBranch,
        IfNode elseBranch,
        SourceInfo source
) implements AstNode {

    public IfNode {
        condition = List.copyOf(condition);
        thenBranch = List.copyOf(thenBranch);
    }

    /**
     * @return {@code true} for a final {@code else} clause, which has no condition.
     */
    public boolean isPlainElse() {
        return condition.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(condition);
        children.addAll(thenBranch);
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }
}
