package org.shellgo.compiler.frontend.irgen;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.parser.ast.AstNode;
import org.shellgo.compiler.frontend.parser.ast.FunctionNode;
import org.shellgo.compiler.frontend.parser.ast.ScriptNode;
import org.shellgo.compiler.frontend.parser.ast.StatementNode;
import org.shellgo.compiler.ir.IrProgram;

/**
 * Phase: builds the IR program from a parsed script by delegating to converters
 * resolved via the {@link IrConverterRegistry}.
 */
public final class IrGenerator {

    private final IrConverterRegistry registry;

    /**
     * Creates a new IR generator with a prepared registry.
     *
     * @param registry The converter registry.
     */
    public IrGenerator(IrConverterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Creates a new IR generator with the standard converters.
     */
    public IrGenerator() {
        this(IrConverterRegistry.initializeWithDefaults());
    }

    /**
     * Builds the program by dispatching each top-level statement to a converter.
     * Nothing is returned if any construct cannot be lowered.
     *
     * @param script The parsed script.
     * @return The generated IR program.
     * @throws UnsupportedConstructException if a construct has no lowering rule.
     */
    public IrProgram generate(ScriptNode script) throws UnsupportedConstructException {
        IrGenContext ctx = new IrGenContext(script.fileName(), registry);
        announceFunctions(script, ctx);
        for (StatementNode statement : script.statements()) {
            ctx.convert(statement);
        }
        return ctx.build();
    }

    private static void announceFunctions(AstNode node, IrGenContext ctx) {
        if (node instanceof FunctionNode function) {
            ctx.announceFunction(function.name());
        }
        for (AstNode child : node.getChildren()) {
            announceFunctions(child, ctx);
        }
    }
}
