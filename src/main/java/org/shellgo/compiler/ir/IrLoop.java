package org.shellgo.compiler.ir;

import org.shellgo.compiler.api.SourceInfo;

import java.util.List;

/**
 * A loop. Which fields are used depends on the {@link LoopKind}:
 * range loops use {@code variable} and {@code range}, list loops use {@code variable}
 * and {@code items}, while/until loops use {@code condition}.
 *
 * @param loopKind The loop kind.
 * @param condition The condition statements of while/until loops; empty otherwise.
 * @param body The loop body.
 * @param variable The loop variable of range/list loops, otherwise {@code null}.
 * @param range The inclusive bounds of a counted range, otherwise {@code null}.
 * @param items The item source expression of a list loop, otherwise {@code null}.
 * @param source The script position.
 */
public record IrLoop(
        LoopKind loopKind,
        List<IrStatement> condition,
        List<IrStatement> body,
        String variable,
        Range range,
        String items,
        SourceInfo source
) implements IrStatement {

    /**
     * Inclusive bounds of a counted loop.
     * @param from The first value.
     * @param to The last value.
     */
    public record Range(int from, int to) {}

    public IrLoop {
        condition = List.copyOf(condition);
        body = List.copyOf(body);
        switch (loopKind) {
            case COUNTED_RANGE -> {
                if (variable == null || range == null) {
                    throw new IllegalArgumentException("A counted loop needs a variable and a range.");
                }
            }
            case ITERATE_LIST -> {
                if (variable == null || items == null) {
                    throw new IllegalArgumentException("A list loop needs a variable and an item source.");
                }
            }
            case WHILE, UNTIL -> {
                if (condition.isEmpty()) {
                    throw new IllegalArgumentException("A " + loopKind + " loop needs a condition.");
                }
            }
        }
    }

    public static IrLoop countedRange(String variable, int from, int to, List<IrStatement> body, SourceInfo source) {
        return new IrLoop(LoopKind.COUNTED_RANGE, List.of(), body, variable, new Range(from, to), null, source);
    }

    public static IrLoop iterateList(String variable, String items, List<IrStatement> body, SourceInfo source) {
        return new IrLoop(LoopKind.ITERATE_LIST, List.of(), body, variable, null, items, source);
    }

    public static IrLoop conditional(boolean until, List<IrStatement> condition, List<IrStatement> body, SourceInfo source) {
        return new IrLoop(until ? LoopKind.UNTIL : LoopKind.WHILE, condition, body, null, null, null, source);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.LOOP;
    }
}
