package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * A variable assignment {@code NAME=value}. The value is {@code null} for bare
 * names in declaration commands such as {@code export NAME}.
 *
 * @param name The variable name.
 * @param value The assigned word, or {@code null}.
 * @param source The position of the assignment.
 */
public record AssignNode(String name, WordNode value, SourceInfo source) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }
}
