package org.shellgo.compiler.backend.build;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs external build tools.
 */
public interface ToolRunner {

    /**
     * Runs a command to completion and captures its output.
     *
     * @param command The program and its arguments.
     * @param workingDirectory The directory the command runs in.
     * @param timeout The time limit.
     * @return The outcome.
     * @throws IOException if the program cannot be started.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    ToolResult run(List<String> command, Path workingDirectory, Duration timeout) throws IOException, InterruptedException;
}
