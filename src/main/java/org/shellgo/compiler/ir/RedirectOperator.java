package org.shellgo.compiler.ir;

public enum RedirectOperator {
    /** {@code >}: truncate or create. */
    TRUNCATE_WRITE,
    /** {@code >>}: append or create. */
    APPEND_WRITE,
    /** {@code <}: read only. */
    READ
}
