package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.ir.IrCommand;

import java.util.List;

/**
 * {@code mkdir} always creates parents, on the final operand.
 */
final class MkdirLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        List<String> operands = Operands.operands(command.args());
        if (operands.isEmpty()) {
            throw new UnsupportedConstructException("mkdir without a directory operand", command.source());
        }
        String dir = ctx.value(operands.get(operands.size() - 1));
        ctx.propagate(out, "os.MkdirAll(" + dir + ", 0755)");
    }
}
