package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.ir.IrFunctionDecl;

/**
 * Function bodies are emitted as top-level Go functions; the declaration site emits nothing.
 */
public final class FunctionDeclLoweringRule implements IStatementLoweringRule<IrFunctionDecl> {

    @Override
    public void lower(IrFunctionDecl statement, CodeBuilder out, EmitContext ctx) {
        // nothing to do
    }
}
