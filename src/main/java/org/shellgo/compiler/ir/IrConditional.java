package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * An {@code if/elif/else} chain with its elif clauses flattened into an ordered list.
 *
 * @param condition The statements of the first condition.
 * @param thenBranch The statements run when it holds.
 * @param elseBranch The final else statements (may be empty).
 * @param elifBranches The elif clauses in source order.
 * @param category The inferred category of the first condition.
 * @param source The script position.
 */
public record IrConditional(
        List<IrStatement> condition,
        List<IrStatement> thenBranch,
        List<IrStatement> elseBranch,
        List<IrElifBranch> elifBranches,
        ConditionCategory category,
        SourceInfo source
) implements IrStatement {

    public IrConditional {
        if (condition.isEmpty()) {
            throw new IllegalArgumentException("A conditional needs at least one condition statement.");
        }
        condition = List.copyOf(condition);
        thenBranch = List.copyOf(thenBranch);
        elseBranch = List.copyOf(elseBranch);
        elifBranches = List.copyOf(elifBranches);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.CONDITIONAL;
    }
}
