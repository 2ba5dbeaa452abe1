package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.ir.IrCommand;

import java.util.Optional;

/**
 * {@code true} and {@code false}.
 */
final class StatusLowering implements IBuiltinLowering {

    private final boolean success;

    StatusLowering(boolean success) {
        this.success = success;
    }

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) {
        if (!success) {
            out.line(ctx.fail("exitStatus(1)"));
        }
    }

    @Override
    public Optional<GoExpr> condition(IrCommand command, EmitContext ctx) {
        return Optional.of(GoExpr.of(String.valueOf(success)));
    }
}
