package org.shellgo.compiler.frontend.irgen;

import java.util.Set;

/**
 * The fixed set of commands that have a native lowering rule.
 */
public final class BuiltinTable {

    private static final Set<String> BUILTINS = Set.of(
            "echo", "cd", "pwd", "mkdir", "rm", "cp", "test", "[", "exit", "export", "read", "source",
            "true", "false", "wait");

    private static final Set<String> REJECTED = Set.of("trap", "eval", "exec", "break", "continue", "[[");

    private BuiltinTable() {}

    /**
     * @param name A literal command name.
     * @return {@code true} if the command is lowered natively.
     */
    public static boolean isBuiltin(String name) {
        return BUILTINS.contains(name);
    }

    /**
     * @param name A literal command name.
     * @return {@code true} for shell commands whose semantics cannot be expressed in the target.
     */
    public static boolean isRejected(String name) {
        return REJECTED.contains(name);
    }
}
