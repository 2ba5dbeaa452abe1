package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

/**
 * {@code return [n]}.
 *
 * @param value A non-numeric return operand (an IR value), or {@code null}.
 * @param code The exit code; 0 when none was given.
 * @param source The script position.
 */
public record IrReturn(String value, int code, SourceInfo source) implements IrStatement {

    @Override
    public StatementKind kind() {
        return StatementKind.RETURN;
    }
}
