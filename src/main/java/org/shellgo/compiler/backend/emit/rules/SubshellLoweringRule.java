package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.AssignedVariables;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.backend.emit.GoSyntax;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.backend.emit.RuntimeHelper;
import org.shellgo.compiler.ir.IrSubshell;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a subshell in its own closure. The working directory is saved on entry and
 * restored by a deferred call, so a {@code cd} inside never leaks out. Variables the
 * subshell writes are shadowed by closure-local copies; writes made by functions it
 * calls still reach the program variables.
 */
public final class SubshellLoweringRule implements IStatementLoweringRule<IrSubshell> {

    @Override
    public void lower(IrSubshell subshell, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        ctx.use(RuntimeHelper.SUBSHELL);
        List<String> body = new ArrayList<>();
        body.add("\tdefer enterSubshell()()");
        for (String name : AssignedVariables.of(subshell.statements())) {
            if (ctx.isVariable(name)) {
                String variable = GoSyntax.variable(name);
                body.add("\t" + variable + " := " + variable);
                body.add("\t_ = " + variable);
            }
        }
        body.addAll(ctx.closureBody(EmitContext.Frame.SUBSHELL, subshell.statements(), "return nil"));
        ctx.propagate(out, GoExpr.closure("func() error {", body, "}()"));
    }
}
