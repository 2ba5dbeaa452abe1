package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.ir.IrRedirection;
import org.shellgo.compiler.ir.RedirectOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens the target file for exactly one statement. The file is closed and the
 * standard stream restored by deferred calls, on success and on failure alike.
 */
public final class RedirectionLoweringRule implements IStatementLoweringRule<IrRedirection> {

    @Override
    public void lower(IrRedirection redirection, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        String target = ctx.value(redirection.target());
        String stream = redirection.operator() == RedirectOperator.READ ? "os.Stdin" : "os.Stdout";

        CodeBuilder body = new CodeBuilder(1);
        body.line("file, err := " + open(redirection.operator(), target));
        body.open("if err != nil {").line("return err").close("}");
        body.line("defer file.Close()");
        body.line("saved := " + stream);
        body.line(stream + " = file");
        body.line("defer func() { " + stream + " = saved }()");

        List<String> statement = ctx.closureBody(EmitContext.Frame.REDIRECTION, List.of(redirection.statement()), "return nil");
        List<String> lines = new ArrayList<>(body.lines());
        lines.addAll(statement);
        ctx.propagate(out, GoExpr.closure("func() error {", lines, "}()"));
    }

    private static String open(RedirectOperator operator, String target) {
        return switch (operator) {
            case TRUNCATE_WRITE -> "os.OpenFile(" + target + ", os.O_WRONLY|os.O_CREATE|os.O_TRUNC, 0644)";
            case APPEND_WRITE -> "os.OpenFile(" + target + ", os.O_WRONLY|os.O_CREATE|os.O_APPEND, 0644)";
            case READ -> "os.Open(" + target + ")";
        };
    }
}
