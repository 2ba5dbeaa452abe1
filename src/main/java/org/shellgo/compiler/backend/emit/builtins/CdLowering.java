package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrValues;

/**
 * {@code cd DIR} changes the working directory; without an argument it goes to {@code $HOME}.
 */
final class CdLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) {
        String dir = command.args().isEmpty() ? IrValues.reference("HOME") : command.args().get(0);
        ctx.propagate(out, "os.Chdir(" + ctx.value(dir) + ")");
    }
}
