package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.WhileNode;
import org.shellgo.compiler.ir.IrLoop;
import org.shellgo.compiler.ir.IrStatement;

import java.util.List;

/**
 * Converts {@code while} and {@code until} loops.
 */
public final class WhileNodeConverter implements IAstNodeToIrConverter<WhileNode> {

    @Override
    public void convert(WhileNode node, IrGenContext ctx) throws UnsupportedConstructException {
        List<IrStatement> condition = ctx.collect(node.condition());
        if (condition.isEmpty()) {
            throw new UnsupportedConstructException("loop condition without a command", node.source());
        }
        ctx.emit(IrLoop.conditional(node.until(), condition, ctx.collect(node.body()), node.source()));
    }
}
