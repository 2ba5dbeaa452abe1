package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.ir.IrCommand;

import java.util.List;

/**
 * {@code cp SRC DST} reads the source file and writes its bytes to the destination.
 */
final class CpLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        List<String> flags = Operands.flags(command.args());
        List<String> operands = Operands.operands(command.args());
        if (Operands.has(flags, 'r') || Operands.has(flags, 'R')) {
            throw new UnsupportedConstructException("recursive cp", command.source());
        }
        if (operands.size() != 2) {
            throw new UnsupportedConstructException("cp with " + operands.size() + " operands", command.source());
        }
        out.open("if data, err := os.ReadFile(" + ctx.value(operands.get(0)) + "); err != nil {");
        out.line(ctx.onError());
        out.reopen("} else if err := os.WriteFile(" + ctx.value(operands.get(1)) + ", data, 0644); err != nil {");
        out.line(ctx.onError());
        out.close("}");
    }
}
