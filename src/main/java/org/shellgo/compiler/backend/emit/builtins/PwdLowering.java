package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.ir.IrCommand;

/**
 * {@code pwd} prints the working directory; failing to read it fails the statement.
 */
final class PwdLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) {
        out.open("if dir, err := os.Getwd(); err != nil {");
        out.line(ctx.onError());
        out.reopen("} else {");
        out.line("fmt.Println(dir)");
        out.close("}");
    }
}
