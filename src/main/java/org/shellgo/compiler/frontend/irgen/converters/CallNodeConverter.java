package org.shellgo.compiler.frontend.irgen.converters;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.irgen.BuiltinTable;
import org.shellgo.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.shellgo.compiler.frontend.irgen.IrGenContext;
import org.shellgo.compiler.frontend.parser.ast.AssignNode;
import org.shellgo.compiler.frontend.parser.ast.CallNode;
import org.shellgo.compiler.ir.Capability;
import org.shellgo.compiler.ir.CommandClass;
import org.shellgo.compiler.ir.ConditionCategory;
import org.shellgo.compiler.ir.IrAssignment;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrReturn;
import org.shellgo.compiler.ir.IrValues;
import org.shellgo.compiler.ir.TestExpression;

import java.util.List;

/**
 * Converts simple commands. Leading assignments become assignments emitted before
 * the command; {@code return} becomes a return statement; every other command is
 * classified as builtin, function call or external process.
 */
public final class CallNodeConverter implements IAstNodeToIrConverter<CallNode> {

    @Override
    public void convert(CallNode node, IrGenContext ctx) throws UnsupportedConstructException {
        for (AssignNode assign : node.assigns()) {
            String value = assign.value() == null ? "" : ctx.value(assign.value());
            ctx.recordVariable(assign.name(), value, false);
            ctx.emit(new IrAssignment(assign.name(), value, ctx.isLocal(assign.name()), false, assign.source()));
        }
        if (node.args().isEmpty()) {
            return;
        }

        String literalName = node.args().get(0).plainLiteral();
        if (literalName != null && BuiltinTable.isRejected(literalName)) {
            throw new UnsupportedConstructException(
                    literalName.equals("[[") ? "test expression '[[ ... ]]'" : "command '" + literalName + "'",
                    node.source());
        }
        if ("return".equals(literalName)) {
            ctx.emit(returnStatement(node, ctx));
            return;
        }
        if (".".equals(literalName)) {
            literalName = "source";
        }

        String name = literalName != null ? IrValues.literal(literalName) : ctx.value(node.args().get(0));
        List<String> args = ctx.values(node.args().subList(1, node.args().size()));
        CommandClass commandClass = ctx.classify(literalName);
        IrCommand command = IrCommand.of(name, args, commandClass, node.source());
        requireCapabilities(command, ctx);
        if (command.isBuiltin() && command.name().equals("read")) {
            declareReadTargets(command, ctx);
        }
        ctx.emit(command);
    }

    private static IrReturn returnStatement(CallNode node, IrGenContext ctx) throws UnsupportedConstructException {
        if (node.args().size() == 1) {
            return new IrReturn(null, 0, node.source());
        }
        String operand = node.args().get(1).plainLiteral();
        if (operand != null && operand.matches("\\d{1,3}")) {
            return new IrReturn(null, Integer.parseInt(operand), node.source());
        }
        return new IrReturn(ctx.value(node.args().get(1)), 0, node.source());
    }

    private static void declareReadTargets(IrCommand command, IrGenContext ctx) {
        boolean named = false;
        for (String arg : command.args()) {
            String text = IrValues.literalText(arg);
            if (text != null && text.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                ctx.declareVariable(text);
                named = true;
            }
        }
        if (!named) {
            ctx.declareVariable("REPLY");
        }
    }

    /**
     * Records what lowering the command will need.
     */
    static void requireCapabilities(IrCommand command, IrGenContext ctx) {
        if (command.commandClass() == CommandClass.EXTERNAL) {
            ctx.require(Capability.PROCESS_EXECUTION);
            return;
        }
        if (!command.isBuiltin()) {
            return;
        }
        switch (command.name()) {
            case "cd", "pwd" -> ctx.require(Capability.WORKING_DIRECTORY);
            case "mkdir", "rm", "cp" -> ctx.require(Capability.FILESYSTEM);
            case "export" -> ctx.require(Capability.ENVIRONMENT);
            case "read" -> ctx.require(Capability.STANDARD_INPUT);
            case "wait" -> ctx.require(Capability.BACKGROUND_JOBS);
            case "test", "[" -> {
                ConditionCategory category = TestExpression.parse(command).category();
                if (category == ConditionCategory.FILE_TEST) {
                    ctx.require(Capability.FILESYSTEM);
                } else if (category == ConditionCategory.GENERIC_COMMAND) {
                    ctx.require(Capability.PROCESS_EXECUTION);
                }
            }
            default -> {
                // echo, exit, source, true and false need nothing beyond the core runtime
            }
        }
    }
}
