package org.shellgo.compiler.ir;

import java.util.List;

/**
 * One {@code elif} clause of an {@link IrConditional}.
 *
 * @param condition The condition statements.
 * @param body The statements run when the condition holds.
 * @param category The inferred category of the condition.
 */
public record IrElifBranch(List<IrStatement> condition, List<IrStatement> body, ConditionCategory category) {

    public IrElifBranch {
        condition = List.copyOf(condition);
        body = List.copyOf(body);
    }
}
