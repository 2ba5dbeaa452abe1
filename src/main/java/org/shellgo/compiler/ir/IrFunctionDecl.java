package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

/**
 * Marks where a function was declared; its body lives in {@link IrProgram#functions()}.
 *
 * @param name The function name.
 * @param source The script position.
 */
public record IrFunctionDecl(String name, SourceInfo source) implements IrStatement {

    @Override
    public StatementKind kind() {
        return StatementKind.FUNCTION_DECL;
    }
}
