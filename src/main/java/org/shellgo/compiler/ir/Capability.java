package org.shellgo.compiler.ir;

/**
 * Runtime facilities a program needs. The IR builder accumulates them while
 * visiting statements; the code generator uses them to decide which support
 * code the generated program carries.
 */
public enum Capability {
    /** Spawns external processes (commands, pipelines, generic tests). */
    PROCESS_EXECUTION,
    /** Reads or writes the process environment. */
    ENVIRONMENT,
    /** Performs filesystem I/O (file builtins, redirections). */
    FILESYSTEM,
    /** Changes or queries the working directory. */
    WORKING_DIRECTORY,
    /** Schedules background work. */
    BACKGROUND_JOBS,
    /** Reads from standard input. */
    STANDARD_INPUT
}
