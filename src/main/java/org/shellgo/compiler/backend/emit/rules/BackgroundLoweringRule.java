package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.ir.IrBackground;

import java.util.List;

/**
 * Schedules the work as a goroutine tracked by the function's job group. The group
 * is joined by {@code wait} and when the function returns.
 */
public final class BackgroundLoweringRule implements IStatementLoweringRule<IrBackground> {

    @Override
    public void lower(IrBackground background, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        ctx.useJobs();
        List<String> body = ctx.closureBody(EmitContext.Frame.JOB, List.of(background.work()), "return nil");
        out.expression("jobs.Go(", GoExpr.closure("func() error {", body, "}"), ")");
    }
}
