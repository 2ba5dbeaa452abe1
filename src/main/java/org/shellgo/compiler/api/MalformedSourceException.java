package org.shellgo.compiler.api;

/**
 * Thrown when the shell front end cannot parse a script. The message is the
 * summary of all collected parser diagnostics and is surfaced verbatim.
 */
public class MalformedSourceException extends CompilationException {

    /**
     * @param message The diagnostics summary.
     */
    public MalformedSourceException(String message) {
        super(message);
    }
}
