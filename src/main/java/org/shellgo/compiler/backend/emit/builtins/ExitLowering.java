package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.RuntimeHelper;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrValues;

/**
 * {@code exit [N]} terminates the process; the default status is 0. Inside a
 * subshell it only leaves the subshell closure, which fails with the status.
 */
final class ExitLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        String status = command.args().isEmpty() ? "0" : IrValues.literalText(command.args().get(0));
        boolean literal = status != null && status.matches("\\d{1,3}");
        if (ctx.inSubshell()) {
            if (ctx.inCondition()) {
                throw new UnsupportedConstructException("exit inside a condition of a subshell", command.source());
            }
            if (!literal) {
                ctx.use(RuntimeHelper.STATUS_FROM);
                out.line("return statusFrom(" + ctx.value(command.args().get(0)) + ")");
            } else if (Integer.parseInt(status) == 0) {
                out.line("return nil");
            } else {
                out.line("return exitStatus(" + Integer.parseInt(status) + ")");
            }
            return;
        }
        if (literal) {
            out.line("os.Exit(" + Integer.parseInt(status) + ")");
        } else {
            ctx.use(RuntimeHelper.ATOI);
            out.line("os.Exit(atoi(" + ctx.value(command.args().get(0)) + "))");
        }
    }
}
