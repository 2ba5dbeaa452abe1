package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A declaration command such as {@code local}, {@code export}, {@code readonly}
 * or {@code declare}.
 *
 * @param variant The declaration keyword.
 * @param flags Option words such as {@code -r} or {@code -x}.
 * @param assigns The declared names, with or without values.
 * @param source The position of the keyword.
 */
public record DeclNode(String variant, List<String> flags, List<AssignNode> assigns, SourceInfo source) implements AstNode {

    public DeclNode {
        flags = List.copyOf(flags);
        assigns = List.copyOf(assigns);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(assigns);
    }
}
