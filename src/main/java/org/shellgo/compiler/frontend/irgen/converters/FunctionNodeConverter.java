package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.BlockNode;
import org.shellgo.compiler.frontend.parser.ast.FunctionNode;
import org.shellgo.compiler.ir.IrFunction;
import org.shellgo.compiler.ir.IrFunctionDecl;
import org.shellgo.compiler.ir.IrStatement;

import java.util.List;

/**
 * Converts function definitions into the function table and leaves a
 * declaration marker at the definition site.
 */
public final class FunctionNodeConverter implements IAstNodeToIrConverter<FunctionNode> {

    @Override
    public void convert(FunctionNode node, IrGenContext ctx) throws UnsupportedConstructException {
        // declared before the body so that recursive calls resolve to the function
        ctx.declareFunction(node.name());
        ctx.enterFunction(node.name(), node.source());
        List<IrStatement> body;
        IrGenContext.FunctionScope scope;
        try {
            if (node.body().command() instanceof BlockNode block && node.body().redirects().isEmpty()) {
                body = ctx.collect(block.statements());
            } else {
                body = ctx.collect(node.body());
            }
        } finally {
            scope = ctx.exitFunction();
        }
        ctx.defineFunction(new IrFunction(node.name(), body, scope.parameters(), scope.locals(), node.source()));
        ctx.emit(new IrFunctionDecl(node.name(), node.source()));
    }
}
