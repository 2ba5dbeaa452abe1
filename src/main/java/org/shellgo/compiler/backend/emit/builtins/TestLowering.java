package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.CodeBuilder;
import org.shellgo.compiler.backend.emit.EmitContext;
import org.shellgo.compiler.backend.emit.GoExpr;
import org.shellgo.compiler.backend.emit.GoSyntax;
import org.shellgo.compiler.backend.emit.RuntimeHelper;
import org.shellgo.compiler.ir.ConditionCategory;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.TestExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code test} and {@code [} become one native check chosen by the condition
 * category. Expressions outside the known categories run the {@code test} program.
 */
final class TestLowering implements IBuiltinLowering {

    @Override
    public void lower(IrCommand command, CodeBuilder out, EmitContext ctx) {
        out.openExpression("if ", expression(command, ctx).not(), " {");
        out.line(ctx.fail("exitStatus(1)"));
        out.close("}");
    }

    @Override
    public Optional<GoExpr> condition(IrCommand command, EmitContext ctx) throws UnsupportedConstructException {
        return Optional.of(expression(command, ctx));
    }

    private static GoExpr expression(IrCommand command, EmitContext ctx) {
        TestExpression test = TestExpression.parse(command);
        GoExpr check = switch (test.category()) {
            case FILE_TEST -> fileTest(test, ctx);
            case STRING_TEST -> GoExpr.of(stringTest(test, ctx));
            case NUMERIC_TEST -> GoExpr.of(numericTest(test, ctx));
            case GENERIC_COMMAND -> GoExpr.of(generic(command, ctx));
        };
        return test.negated() && test.category() != ConditionCategory.GENERIC_COMMAND
                ? check.not()
                : check;
    }

    private static GoExpr fileTest(TestExpression test, EmitContext ctx) {
        ctx.use(RuntimeHelper.FILE_TESTS);
        String function = switch (test.operator()) {
            case "-f" -> "isFile";
            case "-d" -> "isDir";
            default -> "pathExists";
        };
        return GoExpr.of(function + "(" + ctx.value(test.operands().get(0)) + ")");
    }

    private static String stringTest(TestExpression test, EmitContext ctx) {
        List<String> operands = ctx.values(test.operands());
        return switch (test.operator()) {
            case "-z" -> operands.get(0) + " == \"\"";
            case "-n" -> operands.get(0) + " != \"\"";
            case "!=" -> operands.get(0) + " != " + operands.get(1);
            default -> operands.get(0) + " == " + operands.get(1);
        };
    }

    private static String numericTest(TestExpression test, EmitContext ctx) {
        ctx.use(RuntimeHelper.ATOI);
        List<String> operands = ctx.values(test.operands());
        String operator = switch (test.operator()) {
            case "-eq" -> "==";
            case "-ne" -> "!=";
            case "-lt" -> "<";
            case "-le" -> "<=";
            case "-gt" -> ">";
            default -> ">=";
        };
        return "atoi(" + operands.get(0) + ") " + operator + " atoi(" + operands.get(1) + ")";
    }

    private static String generic(IrCommand command, EmitContext ctx) {
        ctx.use(RuntimeHelper.COMMAND_SUCCEEDS);
        List<String> args = new ArrayList<>(command.args());
        if ("[".equals(command.name()) && !args.isEmpty() && "]".equals(args.get(args.size() - 1))) {
            args.remove(args.size() - 1);
        }
        return ctx.processes().runForStatus(GoSyntax.quote("test"), ctx.values(args));
    }
}
