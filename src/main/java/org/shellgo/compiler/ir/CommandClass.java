package org.shellgo.compiler.ir;

/**
 * How a command name is lowered.
 */
public enum CommandClass {
    /** A shell builtin with a native lowering rule. */
    BUILTIN,
    /** A function declared earlier in the same script. */
    FUNCTION,
    /** Anything else; run as an external process. */
    EXTERNAL
}
