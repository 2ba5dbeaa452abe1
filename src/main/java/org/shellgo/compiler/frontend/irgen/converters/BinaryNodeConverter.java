package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.BinaryNode;
import org.shellgo.compiler.frontend.parser.ast.CallNode;
import org.shellgo.compiler.frontend.parser.ast.StatementNode;
import org.shellgo.compiler.ir.Capability;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrConditional;
import org.shellgo.compiler.ir.IrPipeline;
import org.shellgo.compiler.ir.IrStatement;
import org.shellgo.compiler.ir.TestExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts pipelines and and-or lists. Pipelines are flattened into one ordered
 * command list; {@code a && b} becomes a conditional with {@code b} as the then
 * branch, {@code a || b} one with {@code b} as the else branch.
 */
public final class BinaryNodeConverter implements IAstNodeToIrConverter<BinaryNode> {

    @Override
    public void convert(BinaryNode node, IrGenContext ctx) throws UnsupportedConstructException {
        if (node.op() == BinaryNode.Op.PIPE) {
            List<StatementNode> stages = new ArrayList<>();
            flatten(node, stages);
            List<IrCommand> commands = new ArrayList<>();
            for (StatementNode stage : stages) {
                commands.add(stageCommand(stage, ctx));
            }
            ctx.require(Capability.PROCESS_EXECUTION);
            ctx.emit(new IrPipeline(commands, node.source()));
            return;
        }

        List<IrStatement> condition = ctx.collect(node.left());
        List<IrStatement> other = ctx.collect(node.right());
        if (condition.isEmpty()) {
            throw new UnsupportedConstructException("empty condition", node.source());
        }
        boolean and = node.op() == BinaryNode.Op.AND;
        ctx.emit(new IrConditional(
                condition,
                and ? other : List.of(),
                and ? List.of() : other,
                List.of(),
                TestExpression.categoryOf(condition.get(condition.size() - 1)),
                node.source()));
    }

    /**
     * Collects the leaves of nested binary nodes in left-to-right order.
     * Every binary operator is flattened, not only pipes.
     *
     * @param node The binary node.
     * @param out Receives the leaf statements.
     */
    public static void flatten(BinaryNode node, List<StatementNode> out) {
        flattenSide(node.left(), out);
        flattenSide(node.right(), out);
    }

    private static void flattenSide(StatementNode side, List<StatementNode> out) {
        if (side.command() instanceof BinaryNode nested && side.redirects().isEmpty() && !side.negated()) {
            flatten(nested, out);
        } else {
            out.add(side);
        }
    }

    private static IrCommand stageCommand(StatementNode stage, IrGenContext ctx) throws UnsupportedConstructException {
        if (!(stage.command() instanceof CallNode call) || !stage.redirects().isEmpty() || stage.negated()) {
            throw new UnsupportedConstructException("pipeline stage that is not a simple command", stage.source());
        }
        if (!call.assigns().isEmpty() || call.args().isEmpty()) {
            throw new UnsupportedConstructException("assignment in pipeline stage", stage.source());
        }
        List<IrStatement> converted = ctx.collect(call);
        if (converted.size() != 1 || !(converted.get(0) instanceof IrCommand command)) {
            throw new UnsupportedConstructException("pipeline stage that is not a simple command", stage.source());
        }
        return command;
    }
}
