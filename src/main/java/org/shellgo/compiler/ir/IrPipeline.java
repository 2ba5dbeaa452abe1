package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * Commands whose standard output feeds the next command's standard input, left to right.
 *
 * @param commands The stages; never empty.
 * @param source The script position.
 */
public record IrPipeline(List<IrCommand> commands, SourceInfo source) implements IrStatement {

    public IrPipeline {
        if (commands == null || commands.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one command.");
        }
        commands = List.copyOf(commands);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.PIPELINE;
    }
}
