package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

import java.util.Objects;

/**
 * Binds a file to one statement's standard output or input for the lifetime of that statement.
 *
 * @param operator The redirection mode.
 * @param target The file name (an IR value).
 * @param statement The statement the redirection applies to.
 * @param source The script position.
 */
public record IrRedirection(RedirectOperator operator, String target, IrStatement statement, SourceInfo source) implements IrStatement {

    public IrRedirection {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.REDIRECTION;
    }
}
