package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.AssignNode;
import org.shellgo.compiler.frontend.parser.ast.DeclNode;
import org.shellgo.compiler.ir.Capability;
import org.shellgo.compiler.ir.IrAssignment;
import org.shellgo.compiler.ir.IrValues;

/**
 * Converts {@code local}, {@code export}, {@code readonly} and {@code declare} into assignments.
 */
public final class DeclNodeConverter implements IAstNodeToIrConverter<DeclNode> {

    @Override
    public void convert(DeclNode node, IrGenContext ctx) throws UnsupportedConstructException {
        boolean local = node.variant().equals("local")
                || (ctx.inFunction() && (node.variant().equals("declare") || node.variant().equals("typeset")));
        boolean exported = node.variant().equals("export");
        for (String flag : node.flags()) {
            if (flag.contains("a") || flag.contains("A")) {
                throw new UnsupportedConstructException("array declaration '" + node.variant() + " " + flag + "'", node.source());
            }
            if (flag.contains("x")) {
                exported = true;
            }
        }

        for (AssignNode assign : node.assigns()) {
            String value;
            if (assign.value() != null) {
                value = ctx.value(assign.value());
            } else if (exported) {
                // export NAME: publish the current value
                value = IrValues.reference(assign.name());
            } else if (local) {
                value = "";
            } else {
                continue;
            }
            ctx.recordVariable(assign.name(), value, local);
            if (exported) {
                ctx.require(Capability.ENVIRONMENT);
            }
            ctx.emit(new IrAssignment(assign.name(), value, local && ctx.inFunction(), exported, assign.source()));
        }
    }
}
