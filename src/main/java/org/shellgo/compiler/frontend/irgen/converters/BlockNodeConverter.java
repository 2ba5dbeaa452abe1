package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.BlockNode;
import org.shellgo.compiler.frontend.parser.ast.StatementNode;

/**
 * Inlines {@code { ...; }} groups into the enclosing statement list.
 */
public final class BlockNodeConverter implements IAstNodeToIrConverter<BlockNode> {

    @Override
    public void convert(BlockNode node, IrGenContext ctx) throws UnsupportedConstructException {
        for (StatementNode statement : node.statements()) {
            ctx.convert(statement);
        }
    }
}
