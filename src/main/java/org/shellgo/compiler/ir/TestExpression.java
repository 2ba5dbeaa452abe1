package org.shellgo.compiler.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The operands of a {@code test} or {@code [} command with the closing bracket and
 * a leading {@code !} removed, plus the category inferred from its operator.
 *
 * @param negated Whether the expression started with {@code !}.
 * @param operator The operator text, or {@code null} if there is none.
 * @param operands The operands in order, without the operator.
 * @param category The inferred category.
 */
public record TestExpression(boolean negated, String operator, List<String> operands, ConditionCategory category) {

    private static final Set<String> FILE_OPERATORS = Set.of("-f", "-d", "-e");
    private static final Set<String> STRING_OPERATORS = Set.of("-z", "-n", "=", "==", "!=");
    private static final Set<String> NUMERIC_OPERATORS = Set.of("-eq", "-ne", "-lt", "-le", "-gt", "-ge");

    public TestExpression {
        operands = List.copyOf(operands);
    }

    /**
     * @param commandName A command name (an IR value).
     * @return {@code true} for {@code test} and {@code [}.
     */
    public static boolean isTestCommand(String commandName) {
        return "test".equals(commandName) || "[".equals(commandName);
    }

    /**
     * Picks the operator of a test command. With two operands the operator is the first
     * word ({@code -f file}), with three it is the middle one ({@code a = b}).
     *
     * @param command A {@code test} or {@code [} command.
     * @return The parsed expression; {@link ConditionCategory#GENERIC_COMMAND} if no native check applies.
     */
    public static TestExpression parse(IrCommand command) {
        List<String> args = new ArrayList<>(command.args());
        if ("[".equals(command.name()) && !args.isEmpty() && "]".equals(args.get(args.size() - 1))) {
            args.remove(args.size() - 1);
        }
        boolean negated = false;
        if (!args.isEmpty() && "!".equals(args.get(0))) {
            negated = true;
            args.remove(0);
        }
        String operator = null;
        List<String> operands = args;
        if (args.size() == 2) {
            operator = IrValues.literalText(args.get(0));
            operands = List.of(args.get(1));
        } else if (args.size() == 3) {
            operator = IrValues.literalText(args.get(1));
            operands = List.of(args.get(0), args.get(2));
        }
        ConditionCategory category = categoryOf(operator, operands.size());
        return new TestExpression(negated, category == ConditionCategory.GENERIC_COMMAND ? null : operator, operands, category);
    }

    /**
     * Infers the category of the condition that ends with the given statement.
     * @param statement The last statement of a condition list.
     * @return The category; anything but a test command is {@link ConditionCategory#GENERIC_COMMAND}.
     */
    public static ConditionCategory categoryOf(IrStatement statement) {
        if (statement instanceof IrCommand command && command.isBuiltin() && isTestCommand(command.name())) {
            return parse(command).category();
        }
        return ConditionCategory.GENERIC_COMMAND;
    }

    private static ConditionCategory categoryOf(String operator, int operandCount) {
        if (operator == null) {
            return ConditionCategory.GENERIC_COMMAND;
        }
        if (operandCount == 1) {
            if (FILE_OPERATORS.contains(operator)) return ConditionCategory.FILE_TEST;
            if (operator.equals("-z") || operator.equals("-n")) return ConditionCategory.STRING_TEST;
            return ConditionCategory.GENERIC_COMMAND;
        }
        if (STRING_OPERATORS.contains(operator) && !operator.startsWith("-")) return ConditionCategory.STRING_TEST;
        if (NUMERIC_OPERATORS.contains(operator)) return ConditionCategory.NUMERIC_TEST;
        return ConditionCategory.GENERIC_COMMAND;
    }
}
