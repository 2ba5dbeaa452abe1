package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A complete statement: one command together with its redirections and the
 * flags that modify how it runs.
 *
 * @param command The command node (simple command, compound command, binary list, ...).
 * @param redirects The redirections attached to the command, in source order.
 * @param background Whether the statement was terminated by {@code &}.
 * @param negated Whether the statement was prefixed with {@code !}.
 * @param source The position of the statement's first token.
 */
public record StatementNode(
        AstNode command,
        List<RedirectNode> redirects,
        boolean background,
        boolean negated,
        SourceInfo source
) implements AstNode {

    public StatementNode {
        redirects = redirects == null ? List.of() : List.copyOf(redirects);
    }

    /**
     * @return A copy of this statement that runs in the background.
     */
    public StatementNode asBackground() {
        return new StatementNode(command, redirects, true, negated, source);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(command);
        children.addAll(redirects);
        return children;
    }
}
