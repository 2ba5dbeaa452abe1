package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * A single command invocation.
 *
 * @param name The command name (an IR value).
 * @param args The argument values.
 * @param commandClass How the command is lowered.
 * @param useProcessHelper Whether the invocation goes through the process-execution helper.
 * @param source The script position.
 */
public record IrCommand(String name, List<String> args, CommandClass commandClass, boolean useProcessHelper, SourceInfo source)
        implements IrStatement {

    public IrCommand {
        args = List.copyOf(args);
    }

    /**
     * Creates a command whose process-helper flag follows its classification.
     * @param name The command name.
     * @param args The arguments.
     * @param commandClass The classification.
     * @param source The script position.
     * @return The command.
     */
    public static IrCommand of(String name, List<String> args, CommandClass commandClass, SourceInfo source) {
        return new IrCommand(name, args, commandClass, commandClass == CommandClass.EXTERNAL, source);
    }

    /**
     * @return {@code true} if the command has a native lowering rule.
     */
    public boolean isBuiltin() {
        return commandClass == CommandClass.BUILTIN;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.COMMAND;
    }
}
