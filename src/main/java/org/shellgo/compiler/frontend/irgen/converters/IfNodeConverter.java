package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.IfNode;
import org.shellgo.compiler.ir.ConditionCategory;
import org.shellgo.compiler.ir.IrConditional;
import org.shellgo.compiler.ir.IrElifBranch;
import org.shellgo.compiler.ir.IrStatement;
import org.shellgo.compiler.ir.TestExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@code if} clauses. The nested {@code elif} chain is linearized into
 * the conditional's ordered elif list; the final condition-less clause becomes
 * the else branch.
 */
public final class IfNodeConverter implements IAstNodeToIrConverter<IfNode> {

    @Override
    public void convert(IfNode node, IrGenContext ctx) throws UnsupportedConstructException {
        List<IrStatement> condition = ctx.collect(node.condition());
        List<IrStatement> thenBranch = ctx.collect(node.thenBranch());
        List<IrElifBranch> elifs = new ArrayList<>();
        List<IrStatement> elseBranch = List.of();

        IfNode clause = node.elseBranch();
        while (clause != null) {
            if (clause.isPlainElse()) {
                elseBranch = ctx.collect(clause.thenBranch());
                break;
            }
            List<IrStatement> elifCondition = ctx.collect(clause.condition());
            if (elifCondition.isEmpty()) {
                throw new UnsupportedConstructException("elif condition without a command", clause.source());
            }
            elifs.add(new IrElifBranch(elifCondition, ctx.collect(clause.thenBranch()), categoryOf(elifCondition)));
            clause = clause.elseBranch();
        }

        if (condition.isEmpty()) {
            throw new UnsupportedConstructException("condition without a command", node.source());
        }
        ctx.emit(new IrConditional(condition, thenBranch, elseBranch, elifs, categoryOf(condition), node.source()));
    }

    private static ConditionCategory categoryOf(List<IrStatement> condition) {
        return condition.isEmpty()
                ? ConditionCategory.GENERIC_COMMAND
                : TestExpression.categoryOf(condition.get(condition.size() - 1));
    }
}
