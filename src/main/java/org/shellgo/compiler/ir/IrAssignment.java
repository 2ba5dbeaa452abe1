package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

/**
 * {@code NAME=value}.
 *
 * @param name The variable name.
 * @param value The value (an IR value, possibly interpolated).
 * @param local Whether the binding is local to the enclosing function.
 * @param exported Whether the variable is also written to the process environment.
 * @param source The script position.
 */
public record IrAssignment(String name, String value, boolean local, boolean exported, SourceInfo source) implements IrStatement {

    @Override
    public StatementKind kind() {
        return StatementKind.ASSIGNMENT;
    }
}
