package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.rules.PipelineLoweringRule;
import org.shellgo.compiler.ir.CommandClass;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrConditional;
import org.shellgo.compiler.ir.IrPipeline;
import org.shellgo.compiler.ir.IrStatement;
import org.shellgo.compiler.ir.IrValues;

import java.util.List;
import java.util.Optional;

/**
 * Lowers condition statement lists to Go boolean expressions.
 * <p>
 * A single statement with an expression form (a test, a command run for its
 * status, a function call, a pipeline) becomes that expression. Anything else is
 * evaluated inside a {@code func() bool} closure whose failures return {@code false}.
 */
public final class ConditionLowering {

    private ConditionLowering() {}

    /**
     * @param condition The condition statements; never empty.
     * @param ctx The emit context.
     * @return The boolean expression.
     * @throws UnsupportedConstructException if a statement has no lowering rule.
     */
    public static GoExpr lower(List<IrStatement> condition, EmitContext ctx) throws UnsupportedConstructException {
        IrStatement last = condition.get(condition.size() - 1);
        boolean single = condition.size() == 1;
        if (single) {
            Optional<GoExpr> simple = expression(last, ctx);
            if (simple.isPresent()) {
                return simple.get();
            }
        }

        CodeBuilder body = new CodeBuilder(1);
        ctx.pushFrame(EmitContext.Frame.CONDITION);
        try {
            ctx.lowerAll(condition.subList(0, condition.size() - 1), body);
            Optional<GoExpr> result = single ? Optional.empty() : expression(last, ctx);
            if (result.isPresent()) {
                body.expression("return ", result.get(), "");
            } else {
                ctx.lower(last, body);
                body.line("return true");
            }
        } finally {
            ctx.popFrame();
        }
        return GoExpr.closure("func() bool {", body.lines(), "}()");
    }

    /**
     * @param statement A statement whose status is tested.
     * @param ctx The emit context.
     * @return The expression form of the statement, if it has one.
     * @throws UnsupportedConstructException if a statement has no lowering rule.
     */
    public static Optional<GoExpr> expression(IrStatement statement, EmitContext ctx) throws UnsupportedConstructException {
        if (statement instanceof IrCommand command) {
            return commandExpression(command, ctx);
        }
        if (statement instanceof IrPipeline pipeline) {
            return Optional.of(PipelineLoweringRule.expression(pipeline, ctx).wrap("", " == nil"));
        }
        if (statement instanceof IrConditional conditional && conditional.elifBranches().isEmpty()) {
            boolean thenOnly = !conditional.thenBranch().isEmpty() && conditional.elseBranch().isEmpty();
            boolean elseOnly = conditional.thenBranch().isEmpty() && !conditional.elseBranch().isEmpty();
            if (thenOnly) {
                return Optional.of(lower(conditional.condition(), ctx).and(lower(conditional.thenBranch(), ctx)));
            }
            if (elseOnly) {
                return Optional.of(lower(conditional.condition(), ctx).or(lower(conditional.elseBranch(), ctx)));
            }
        }
        return Optional.empty();
    }

    private static Optional<GoExpr> commandExpression(IrCommand command, EmitContext ctx) throws UnsupportedConstructException {
        switch (command.commandClass()) {
            case BUILTIN -> {
                return ctx.builtins().resolve(command).condition(command, ctx);
            }
            case FUNCTION -> {
                return Optional.of(GoExpr.of(functionCall(command, ctx.values(command.args())) + " == nil"));
            }
            default -> {
                ctx.use(RuntimeHelper.COMMAND_SUCCEEDS);
                String name = ctx.value(command.name());
                return Optional.of(GoExpr.of(ctx.processes().runForStatus(name, ctx.values(command.args()))));
            }
        }
    }

    /**
     * @param command A call of a script function.
     * @param args The Go argument expressions.
     * @return The Go call.
     */
    public static String functionCall(IrCommand command, List<String> args) {
        if (command.commandClass() != CommandClass.FUNCTION) {
            throw new IllegalArgumentException("Not a function call: " + command.name());
        }
        String name = IrValues.literalText(command.name());
        return GoSyntax.function(name) + "(" + String.join(", ", args) + ")";
    }
}
