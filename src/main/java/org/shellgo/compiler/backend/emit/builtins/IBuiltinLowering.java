package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.ir.IrCommand;

import java.util.Optional;

/**
 * The fixed native lowering of one builtin command.
 */
public interface IBuiltinLowering {

    /**
     * Writes the builtin as Go statements. A failure stops the current body.
     *
     * @param command The builtin invocation.
     * @param out The code being written.
     * @param ctx The emit context.
     * @throws UnsupportedConstructException if the invocation has no faithful lowering.
     */
    void lower(IrCommand command, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException;

    /**
     * Returns the builtin as a boolean expression, for builtins whose status is
     * commonly tested. Returning empty must not record any dependency.
     *
     * @param command The builtin invocation.
     * @param ctx The emit context.
     * @return The expression, or empty if the builtin is lowered as a statement instead.
     * @throws UnsupportedConstructException if the invocation has no faithful lowering.
     */
    default Optional<GoExpr> condition(IrCommand command, EmitContext ctx) throws UnsupportedConstructException {
        return Optional.empty();
    }
}
