package org.shellgo.compiler.api;

/**
 * Thrown by the IR builder or the code generator when a construct has no lowering
 * rule. It always aborts the whole conversion; no partial IR or source is produced.
 */
public class UnsupportedConstructException extends CompilationException {

    private final String kind;

    /**
     * @param kind A short, user-facing name of the offending construct (e.g. "case statement").
     */
    public UnsupportedConstructException(String kind) {
        super("Unsupported construct: " + kind);
        this.kind = kind;
    }

    /**
     * @param kind A short, user-facing name of the offending construct.
     * @param sourceInfo Where the construct appears in the script.
     */
    public UnsupportedConstructException(String kind, SourceInfo sourceInfo) {
        super("Unsupported construct: " + kind, sourceInfo);
        this.kind = kind;
    }

    /**
     * @return The name of the construct that could not be lowered.
     */
    public String kind() {
        return kind;
    }
}
