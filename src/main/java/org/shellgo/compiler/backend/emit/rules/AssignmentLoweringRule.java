package org.shellgo.compiler.backend.emit.rules;

import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoSyntax;
import org.shellgo.compiler.backend.emit.IStatementLoweringRule;
import org.shellgo.compiler.ir.IrAssignment;
import org.shellgo.compiler.ir.IrValues;

/**
 * Assigns the Go variable of a shell variable; exported variables are also
 * published to the process environment.
 */
public final class AssignmentLoweringRule implements IStatementLoweringRule<IrAssignment> {

    @Override
    public void lower(IrAssignment assignment, CodeBuilder out, EmitContext ctx) {
        String target = ctx.target(assignment.name());
        if (!assignment.value().equals(IrValues.reference(assignment.name()))) {
            out.line(target + " = " + ctx.value(assignment.value()));
        }
        if (assignment.exported()) {
            ctx.propagate(out, "os.Setenv(" + GoSyntax.quote(assignment.name()) + ", " + target + ")");
        }
    }
}
