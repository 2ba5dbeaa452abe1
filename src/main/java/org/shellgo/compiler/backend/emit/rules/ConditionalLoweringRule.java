package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.ir.IrConditional;
import org.shellgo.compiler.ir.IrElifBranch;

/**
 * Lowers conditionals to {@code if} / {@code else if} / {@code else} chains in source order.
 */
public final class ConditionalLoweringRule implements IStatementLoweringRule<IrConditional> {

    @Override
    public void lower(IrConditional conditional, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        GoExpr condition = ctx.condition(conditional.condition());
        boolean onlyElse = conditional.thenBranch().isEmpty() && conditional.elifBranches().isEmpty();

        if (onlyElse && conditional.elseBranch().isEmpty()) {
            // evaluated for its effects only
            out.expression("_ = ", condition, "");
            return;
        }
        if (onlyElse) {
            out.openExpression("if ", condition.not(), " {");
            ctx.lowerAll(conditional.elseBranch(), out);
            out.close("}");
            return;
        }

        out.openExpression("if ", condition, " {");
        ctx.lowerAll(conditional.thenBranch(), out);
        for (IrElifBranch elif : conditional.elifBranches()) {
            out.reopenExpression("} else if ", ctx.condition(elif.condition()), " {");
            ctx.lowerAll(elif.body(), out);
        }
        if (!conditional.elseBranch().isEmpty()) {
            out.reopen("} else {");
            ctx.lowerAll(conditional.elseBranch(), out);
        }
        out.close("}");
    }
}
