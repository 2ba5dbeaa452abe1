package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoSyntax;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrValues;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code export NAME[=VALUE]...} sets process environment variables.
 */
final class ExportLowering implements IBuiltinLowering {

    private static final Pattern ASSIGNMENT = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)(?:=(.*))?", Pattern.DOTALL);

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        for (String arg : command.args()) {
            Matcher m = ASSIGNMENT.matcher(arg);
            if (!m.matches()) {
                throw new UnsupportedConstructException("export of '" + arg + "'", command.source());
            }
            String name = m.group(1);
            String value = m.group(2) != null ? m.group(2) : IrValues.reference(name);
            ctx.propagate(out, "os.Setenv(" + GoSyntax.quote(name) + ", " + ctx.value(value) + ")");
        }
    }
}
