package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.ir.IrAssignment;
import org.shellgo.compiler.ir.IrBackground;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrConditional;
import org.shellgo.compiler.ir.IrElifBranch;
import org.shellgo.compiler.ir.IrLoop;
import org.shellgo.compiler.ir.IrRedirection;
import org.shellgo.compiler.ir.IrStatement;
import org.shellgo.compiler.ir.IrValues;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the variables a block of statements writes directly: assignments,
 * loop variables and {@code read} targets. Nested subshells are skipped because
 * they isolate their own writes, and function bodies are not followed.
 */
public final class AssignedVariables {

    private final SortedSet<String> names = new TreeSet<>();

    private AssignedVariables() {}

    /**
     * @param statements The block.
     * @return The written names in sorted order.
     */
    public static SortedSet<String> of(List<IrStatement> statements) {
        AssignedVariables collector = new AssignedVariables();
        collector.visitAll(statements);
        return collector.names;
    }

    private void visitAll(List<IrStatement> statements) {
        for (IrStatement statement : statements) {
            visit(statement);
        }
    }

    private void visit(IrStatement statement) {
        if (statement instanceof IrAssignment assignment) {
            names.add(assignment.name());
        } else if (statement instanceof IrLoop loop) {
            if (loop.variable() != null) {
                names.add(loop.variable());
            }
            visitAll(loop.condition());
            visitAll(loop.body());
        } else if (statement instanceof IrConditional conditional) {
            visitAll(conditional.condition());
            visitAll(conditional.thenBranch());
            for (IrElifBranch elif : conditional.elifBranches()) {
                visitAll(elif.condition());
                visitAll(elif.body());
            }
            visitAll(conditional.elseBranch());
        } else if (statement instanceof IrRedirection redirection) {
            visit(redirection.statement());
        } else if (statement instanceof IrBackground background) {
            visit(background.work());
        } else if (statement instanceof IrCommand command) {
            readTargets(command);
        }
    }

    private void readTargets(IrCommand command) {
        if (!command.isBuiltin() || !"read".equals(IrValues.literalText(command.name()))) {
            return;
        }
        boolean named = false;
        for (String arg : command.args()) {
            String text = IrValues.literalText(arg);
            if (text != null && text.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                names.add(text);
                named = true;
            }
        }
        if (!named) {
            names.add("REPLY");
        }
    }
}
