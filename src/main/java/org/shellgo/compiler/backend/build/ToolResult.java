package org.shellgo.compiler.backend.build;

/**
 * Outcome of one external tool invocation.
 *
 * @param exitCode The process exit code; -1 if the tool timed out.
 * @param output Standard output and standard error, interleaved.
 * @param timedOut Whether the tool was killed for exceeding its time limit.
 */
public record ToolResult(int exitCode, String output, boolean timedOut) {

    /**
     * @return {@code true} if the tool finished with exit code 0.
     */
    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
