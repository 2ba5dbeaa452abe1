package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * Statements run in an isolated scope: working-directory changes do not leak out.
 *
 * @param statements The statements.
 * @param source The script position.
 */
public record IrSubshell(List<IrStatement> statements, SourceInfo source) implements IrStatement {

    public IrSubshell {
        statements = List.copyOf(statements);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.SUBSHELL;
    }
}
