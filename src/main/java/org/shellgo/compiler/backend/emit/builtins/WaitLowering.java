package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.ir.IrCommand;

/**
 * {@code wait} joins the background jobs of the current function and fails with the first job failure.
 */
final class WaitLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) {
        ctx.useJobs();
        ctx.propagate(out, "jobs.Wait()");
    }
}
