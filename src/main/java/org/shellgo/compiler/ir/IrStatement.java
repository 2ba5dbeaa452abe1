package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

/**
 * A statement of the intermediate representation. The hierarchy is closed: one
 * record per {@link StatementKind}, so a statement always carries exactly one payload
 * and consumers can switch over it exhaustively.
 */
public sealed interface IrStatement permits IrCommand, IrAssignment, IrConditional, IrLoop, IrPipeline,
        IrSubshell, IrRedirection, IrBackground, IrReturn, IrFunctionDecl {

    /**
     * @return The tag identifying the payload.
     */
    StatementKind kind();

    /**
     * @return The script position the statement was lowered from.
     */
    SourceInfo source();
}
