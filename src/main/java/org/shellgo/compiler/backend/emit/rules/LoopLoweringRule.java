package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.ir.IrLoop;
import org.shellgo.compiler.ir.IrValues;

/**
 * Lowers the four loop kinds to Go {@code for} statements.
 */
public final class LoopLoweringRule implements IStatementLoweringRule<IrLoop> {

    @Override
    public void lower(IrLoop loop, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        switch (loop.loopKind()) {
            case ITERATE_LIST -> {
                String variable = ctx.target(loop.variable());
                out.open("for _, " + variable + " = range " + items(loop.items(), ctx) + " {");
            }
            case COUNTED_RANGE -> {
                String counter = ctx.uniqueName("i");
                ctx.importPackage("strconv");
                out.open("for " + counter + " := " + loop.range().from() + "; " + counter + " <= " + loop.range().to()
                        + "; " + counter + "++ {");
                out.line(ctx.target(loop.variable()) + " = strconv.Itoa(" + counter + ")");
            }
            case WHILE -> out.openExpression("for ", ctx.condition(loop.condition()), " {");
            case UNTIL -> out.openExpression("for ", ctx.condition(loop.condition()).not(), " {");
        }
        ctx.lowerAll(loop.body(), out);
        out.close("}");
    }

    private static String items(String items, EmitContext ctx) {
        if (items.equals(IrValues.reference("@")) || items.equals(IrValues.reference("*"))) {
            return "args";
        }
        ctx.importPackage("strings");
        return "strings.Fields(" + ctx.value(items) + ")";
    }
}
