package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.ConditionLowering;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.backend.emit.RuntimeHelper;
import org.shellgo.compiler.ir.IrCommand;

/**
 * Builtins go to their fixed lowering, script functions are called directly and
 * every other command runs as an external process whose output is printed.
 */
public final class CommandLoweringRule implements IStatementLoweringRule<IrCommand> {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException {
        switch (command.commandClass()) {
            case BUILTIN -> ctx.builtins().resolve(command).lower(command, out, ctx);
            case FUNCTION -> ctx.propagate(out, ConditionLowering.functionCall(command, ctx.values(command.args())));
            case EXTERNAL -> {
                ctx.use(RuntimeHelper.RUN_COMMAND);
                String name = ctx.value(command.name());
                ctx.propagate(out, ctx.processes().runAndCapture(name, ctx.values(command.args())));
            }
        }
    }
}
