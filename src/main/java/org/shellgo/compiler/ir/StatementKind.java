package org.shellgo.compiler.ir;

/**
 * Tag of an {@link IrStatement}; each kind has exactly one record type.
 */
public enum StatementKind {
    COMMAND,
    ASSIGNMENT,
    CONDITIONAL,
    LOOP,
    PIPELINE,
    SUBSHELL,
    REDIRECTION,
    BACKGROUND,
    RETURN,
    FUNCTION_DECL
}
