package org.shellgo.compiler.ir;

public enum LoopKind {
    /** {@code for x in {1..5}} */
    COUNTED_RANGE,
    /** {@code for x in a b c} */
    ITERATE_LIST,
    /** {@code while cond} */
    WHILE,
    /** {@code until cond} */
    UNTIL
}
