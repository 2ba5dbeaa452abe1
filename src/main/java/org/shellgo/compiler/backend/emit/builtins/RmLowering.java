package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.ir.IrCommand;

import java.util.List;

/**
 * {@code rm} removes the last operand; {@code -r} selects the recursive variant and
 * {@code -f} ignores a missing file.
 */
final class RmLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        List<String> flags = Operands.flags(command.args());
        List<String> operands = Operands.operands(command.args());
        if (operands.isEmpty()) {
            throw new UnsupportedConstructException("rm without a file operand", command.source());
        }
        boolean recursive = Operands.has(flags, 'r') || Operands.has(flags, 'R');
        String call = (recursive ? "os.RemoveAll(" : "os.Remove(") + ctx.value(operands.get(operands.size() - 1)) + ")";
        if (Operands.has(flags, 'f')) {
            out.open("if err := " + call + "; err != nil && !os.IsNotExist(err) {");
            out.line(ctx.onError());
            out.close("}");
        } else {
            ctx.propagate(out, call);
        }
    }
}
