package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.backend.emit.RuntimeHelper;
import org.shellgo.compiler.ir.IrReturn;

/**
 * Status 0 returns {@code nil}; any other status returns it as an {@code exitStatus}.
 */
public final class ReturnLoweringRule implements IStatementLoweringRule<IrReturn> {

    @Override
    public void lower(IrReturn statement, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        if (ctx.inCondition()) {
            throw new UnsupportedConstructException("return inside a condition", statement.source());
        }
        if (!ctx.canReturn()) {
            throw new UnsupportedConstructException("return inside a redirected or background statement", statement.source());
        }
        if (statement.value() != null) {
            ctx.use(RuntimeHelper.STATUS_FROM);
            out.line("return statusFrom(" + ctx.value(statement.value()) + ")");
        } else if (statement.code() == 0) {
            out.line("return nil");
        } else {
            out.line("return exitStatus(" + statement.code() + ")");
        }
    }
}
