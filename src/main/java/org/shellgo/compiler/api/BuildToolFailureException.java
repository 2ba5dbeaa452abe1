package org.shellgo.compiler.api;

/**
 * Thrown when one of the build driver's steps fails: workspace setup, dependency
 * manifest resolution, compilation or relocation of the artifact. The captured
 * diagnostic output of the failing tool is kept verbatim.
 */
public class BuildToolFailureException extends CompilationException {

    private final String step;
    private final String toolOutput;

    /**
     * @param step The name of the failed step.
     * @param message A short description of the failure.
     * @param toolOutput The tool's captured output (may be empty).
     */
    public BuildToolFailureException(String step, String message, String toolOutput) {
        super(formatMessage(step, message, toolOutput));
        this.step = step;
        this.toolOutput = toolOutput == null ? "" : toolOutput;
    }

    /**
     * @param step The name of the failed step.
     * @param message A short description of the failure.
     * @param cause The underlying I/O or process failure.
     */
    public BuildToolFailureException(String step, String message, Throwable cause) {
        super(formatMessage(step, message, cause.getMessage()), cause);
        this.step = step;
        this.toolOutput = "";
    }

    public String step() {
        return step;
    }

    public String toolOutput() {
        return toolOutput;
    }

    private static String formatMessage(String step, String message, String output) {
        String head = step + ": " + message;
        if (output == null || output.isBlank()) {
            return head;
        }
        return head + "\n" + output.stripTrailing();
    }
}
