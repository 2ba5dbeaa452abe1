package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.VariableSplicer;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrValues;

import java.util.List;

/**
 * {@code echo} prints its arguments joined by spaces. Leading {@code -n}, {@code -e}
 * and {@code -E} options are consumed; {@code -n} drops the newline.
 */
final class EchoLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) {
        List<String> args = command.args();
        boolean newline = true;
        int first = 0;
        while (first < args.size()) {
            String text = IrValues.literalText(args.get(first));
            if (text == null || !text.matches("-[neE]+")) {
                break;
            }
            if (text.indexOf('n') >= 0) {
                newline = false;
            }
            first++;
        }
        List<String> printed = args.subList(first, args.size());
        if (printed.isEmpty()) {
            out.line(newline ? "fmt.Println()" : "fmt.Print(\"\")");
            return;
        }
        String text = VariableSplicer.join(printed, ctx);
        out.line((newline ? "fmt.Println(" : "fmt.Print(") + text + ")");
    }
}
