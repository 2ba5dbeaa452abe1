package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.backend.emit.RuntimeHelper;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code read [-r] NAME...} reads one line from standard input into the named
 * variables ({@code REPLY} without names). It fails at end of input.
 */
final class ReadLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        GoExpr read = GoExpr.of(call(command, ctx));
        out.openExpression("if ", read.not(), " {");
        out.line(ctx.fail("exitStatus(1)"));
        out.close("}");
    }

    @Override
    public Optional<GoExpr> condition(IrCommand command, EmitContext ctx) throws UnsupportedConstructException {
        return Optional.of(GoExpr.of(call(command, ctx)));
    }

    private static String call(IrCommand command, EmitContext ctx) throws UnsupportedConstructException {
        for (String flag : Operands.flags(command.args())) {
            if (!flag.equals("r")) {
                throw new UnsupportedConstructException("read option '-" + flag + "'", command.source());
            }
        }
        List<String> targets = new ArrayList<>();
        for (String arg : Operands.operands(command.args())) {
            String name = IrValues.literalText(arg);
            if (name == null || !name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                throw new UnsupportedConstructException("read into '" + arg + "'", command.source());
            }
            targets.add("&" + ctx.target(name));
        }
        if (targets.isEmpty()) {
            targets.add("&" + ctx.target("REPLY"));
        }
        ctx.use(RuntimeHelper.READ_FIELDS);
        return "readFields(" + String.join(", ", targets) + ")";
    }
}
