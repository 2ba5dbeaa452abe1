package org.shellgo.compiler.frontend.irgen;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.parser.ast.AstNode;

/**
 * Converts a specific syntax node type into zero or more IR statements.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link IrGenContext}.
 *
 * @param <T> The concrete syntax node type handled by this converter.
 */
public interface IAstNodeToIrConverter<T extends AstNode> {

    /**
     * Converts the given node into IR and emits results via the provided context.
     *
     * @param node The node to convert.
     * @param ctx  The IR generation context used to emit statements.
     * @throws UnsupportedConstructException if the node, or anything inside it, has no lowering rule.
     */
    void convert(T node, IrGenContext ctx) throws UnsupportedConstructException;
}
