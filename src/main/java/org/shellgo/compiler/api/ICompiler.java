package org.shellgo.compiler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface of the shell-to-Go compiler.
 */
public interface ICompiler {

    /**
     * Translates a shell script into Go source text.
     *
     * @param script The script text.
     * @param scriptName A name for the script, used in diagnostics.
     * @return The generated Go source.
     * @throws CompilationException if the script is malformed or uses a construct without a lowering rule.
     */
    String convert(String script, String scriptName) throws CompilationException;

    /**
     * Translates a shell script and compiles the result into a standalone executable.
     *
     * @param script The script text.
     * @param scriptName A name for the script, used in diagnostics.
     * @param outputPath Where the executable is placed.
     * @throws CompilationException if conversion or any build step fails.
     */
    void build(String script, String scriptName, Path outputPath) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=trace).
     */
    void setVerbosity(int level);

    /**
     * Translates the script stored in a file.
     * @param scriptPath The path to the script.
     * @return The generated Go source.
     * @throws CompilationException if conversion fails.
     * @throws IOException if the file cannot be read.
     */
    default String convert(Path scriptPath) throws CompilationException, IOException {
        return convert(Files.readString(scriptPath), scriptPath.toString());
    }
}
