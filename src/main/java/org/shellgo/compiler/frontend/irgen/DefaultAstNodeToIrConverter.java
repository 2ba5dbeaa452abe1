package org.shellgo.compiler.frontend.irgen;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.parser.ast.ArithmeticCommandNode;
import org.shellgo.compiler.frontend.parser.ast.ArithmeticForNode;
import org.shellgo.compiler.frontend.parser.ast.AstNode;
import org.shellgo.compiler.frontend.parser.ast.CaseNode;

/**
 * Fallback converter used when no specific converter is registered.
 * Every node that reaches it aborts the conversion.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<AstNode> {

    @Override
    public void convert(AstNode node, IrGenContext ctx) throws UnsupportedConstructException {
        throw new UnsupportedConstructException(describe(node), ctx.sourceOf(node));
    }

    static String describe(AstNode node) {
        if (node instanceof CaseNode) return "case statement";
        if (node instanceof ArithmeticForNode) return "arithmetic for loop 'for ((...))'";
        if (node instanceof ArithmeticCommandNode) return "arithmetic command '((...))'";
        String name = node.getClass().getSimpleName();
        return name.endsWith("Node") ? name.substring(0, name.length() - 4) : name;
    }
}
