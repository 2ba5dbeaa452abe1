package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

/**
 * A command or pipeline started concurrently and not awaited where it is declared.
 *
 * @param work The wrapped {@link IrCommand} or {@link IrPipeline}.
 * @param source The script position.
 */
public record IrBackground(IrStatement work, SourceInfo source) implements IrStatement {

    public IrBackground {
        if (!(work instanceof IrCommand) && !(work instanceof IrPipeline)) {
            throw new IllegalArgumentException("Only commands and pipelines can run in the background, got " + work);
        }
    }

    @Override
    public StatementKind kind() {
        return StatementKind.BACKGROUND;
    }
}
