package org.shellgo.compiler.ir;

/**
 * The kind of check a condition performs, inferred from {@code test}/{@code [} operators.
 */
public enum ConditionCategory {
    /** {@code -f}, {@code -d}, {@code -e} */
    FILE_TEST,
    /** {@code -z}, {@code -n}, {@code =}, {@code !=} */
    STRING_TEST,
    /** {@code -eq}, {@code -ne}, {@code -lt}, {@code -le}, {@code -gt}, {@code -ge} */
    NUMERIC_TEST,
    /** Any other command; its exit status decides. */
    GENERIC_COMMAND
}
