package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A simple command: optional leading assignments followed by words. The first
 * word, if any, is the command name.
 *
 * @param assigns Leading {@code NAME=value} assignments.
 * @param args The command words.
 * @param source The position of the first token.
 */
public record CallNode(List<AssignNode> assigns, List<WordNode> args, SourceInfo source) implements AstNode {

    public CallNode {
        assigns = List.copyOf(assigns);
        args = List.copyOf(args);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(assigns);
        children.addAll(args);
        return children;
    }
}
