package org.shellgo.compiler.backend.emit.builtins;

import org.shellgo.compiler.ir.IrValues;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits builtin arguments into literal option flags and operands.
 */
final class Operands {

    private Operands() {}

    /**
     * @param args IR argument values.
     * @return The literal arguments starting with {@code -}, without the dash.
     */
    static List<String> flags(List<String> args) {
        List<String> flags = new ArrayList<>();
        for (String arg : args) {
            String text = IrValues.literalText(arg);
            if (isFlag(text)) {
                flags.add(text.substring(1));
            }
        }
        return flags;
    }

    /**
     * @param args IR argument values.
     * @return The arguments that are not option flags.
     */
    static List<String> operands(List<String> args) {
        List<String> operands = new ArrayList<>();
        for (String arg : args) {
            if (!isFlag(IrValues.literalText(arg))) {
                operands.add(arg);
            }
        }
        return operands;
    }

    /**
     * @param flags Flags as returned by {@link #flags}.
     * @param letter An option letter.
     * @return {@code true} if any flag contains the letter.
     */
    static boolean has(List<String> flags, char letter) {
        return flags.stream().anyMatch(flag -> flag.indexOf(letter) >= 0);
    }

    private static boolean isFlag(String text) {
        return text != null && text.length() > 1 && text.startsWith("-");
    }
}
