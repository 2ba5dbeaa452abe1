package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.SubshellNode;
import org.shellgo.compiler.ir.Capability;
import org.shellgo.compiler.ir.IrSubshell;

/**
 * Converts {@code ( ... )} into an isolated subshell.
 */
public final class SubshellNodeConverter implements IAstNodeToIrConverter<SubshellNode> {

    @Override
    public void convert(SubshellNode node, IrGenContext ctx) throws UnsupportedConstructException {
        ctx.require(Capability.WORKING_DIRECTORY);
        ctx.emit(new IrSubshell(ctx.collect(node.statements()), node.source()));
    }
}
