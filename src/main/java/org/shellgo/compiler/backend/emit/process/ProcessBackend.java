package org.shellgo.compiler.backend.emit.process;

import org.shellgo.compiler.backend.emit.RuntimeHelper;

import java.util.List;
import java.util.Set;

/**
 * The process-execution capability of generated programs. Lowering rules describe
 * what to run; a backend decides how the generated Go code spawns, wires and waits
 * for processes. All arguments are Go expressions.
 */
public interface ProcessBackend {

    /**
     * @return The configuration name of the backend.
     */
    String name();

    /**
     * @return Go packages the in-line pipeline code needs.
     */
    Set<String> pipelineImports();

    /**
     * @param helper {@link RuntimeHelper#RUN_COMMAND} or {@link RuntimeHelper#COMMAND_SUCCEEDS}.
     * @return The Go source of the helper.
     */
    String helperSource(RuntimeHelper helper);

    /**
     * @param helper A process helper.
     * @return The Go packages its source imports.
     */
    Set<String> helperImports(RuntimeHelper helper);

    /**
     * @param handle The Go variable receiving the process handle.
     * @param name The command name expression.
     * @param args The argument expressions.
     * @return A statement creating the process without starting it.
     */
    String spawn(String handle, String name, List<String> args);

    /**
     * @param from The handle whose output is read.
     * @param pipe The Go variable receiving the pipe.
     * @return A statement creating the pipe; it declares {@code pipe} and {@code err}.
     */
    String openPipe(String from, String pipe);

    /**
     * Releases the parent's end of a pipe once the reading stage has started, so
     * the writing stage sees a broken pipe when that reader exits early.
     * @param pipe A pipe created by {@link #openPipe}.
     * @return A statement closing the pipe.
     */
    String closePipe(String pipe);

    /**
     * @param to The handle whose input is set.
     * @param source The Go expression providing the input.
     * @return A statement binding the input.
     */
    String bindInput(String to, String source);

    /**
     * @param handle The handle whose output is set.
     * @param sink The Go expression receiving the output.
     * @return A statement binding the output.
     */
    String bindOutput(String handle, String sink);

    /**
     * @param handle The handle whose error stream is set.
     * @param sink The Go expression receiving the error stream.
     * @return A statement binding the error stream.
     */
    String bindErrors(String handle, String sink);

    /**
     * @param handle A spawned handle.
     * @return An expression starting the process and yielding an error.
     */
    String start(String handle);

    /**
     * @param handle A started handle.
     * @return An expression waiting for the process and yielding an error.
     */
    String await(String handle);

    /**
     * @param name The command name expression.
     * @param args The argument expressions.
     * @return An expression that runs the command, prints its combined output and yields an error.
     */
    String runAndCapture(String name, List<String> args);

    /**
     * @param name The command name expression.
     * @param args The argument expressions.
     * @return A boolean expression that runs the command and reports success.
     */
    String runForStatus(String name, List<String> args);
}
