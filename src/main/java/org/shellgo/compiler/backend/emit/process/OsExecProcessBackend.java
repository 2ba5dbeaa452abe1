package org.shellgo.compiler.backend.emit.process;

import org.shellgo.compiler.backend.emit.RuntimeHelper;

import java.util.List;
import java.util.Set;

/**
 * Process execution through Go's {@code os/exec} package.
 */
public final class OsExecProcessBackend implements ProcessBackend {

    /** Configuration name of this backend. */
    public static final String NAME = "os-exec";

    private static final String RUN_COMMAND = """
            func runCommand(name string, args ...string) error {
            \tcmd := exec.Command(name, args...)
            \tcmd.Stdin = os.Stdin
            \toutput, err := cmd.CombinedOutput()
            \tfmt.Print(string(output))
            \tif err != nil {
            \t\tvar exitErr *exec.ExitError
            \t\tif errors.As(err, &exitErr) {
            \t\t\treturn exitStatus(exitErr.ExitCode())
            \t\t}
            \t\treturn fmt.Errorf("%s: %w", name, err)
            \t}
            \treturn nil
            }
            """;

    private static final String COMMAND_SUCCEEDS = """
            func commandSucceeds(name string, args ...string) bool {
            \tcmd := exec.Command(name, args...)
            \tcmd.Stdin = os.Stdin
            \tcmd.Stdout = os.Stdout
            \tcmd.Stderr = os.Stderr
            \treturn cmd.Run() == nil
            }
            """;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> pipelineImports() {
        return Set.of("os/exec");
    }

    @Override
    public String helperSource(RuntimeHelper helper) {
        return switch (helper) {
            case RUN_COMMAND -> RUN_COMMAND;
            case COMMAND_SUCCEEDS -> COMMAND_SUCCEEDS;
            default -> throw new IllegalArgumentException("Not a process helper: " + helper);
        };
    }

    @Override
    public Set<String> helperImports(RuntimeHelper helper) {
        return switch (helper) {
            case RUN_COMMAND -> Set.of("errors", "fmt", "os", "os/exec");
            case COMMAND_SUCCEEDS -> Set.of("os", "os/exec");
            default -> throw new IllegalArgumentException("Not a process helper: " + helper);
        };
    }

    @Override
    public String spawn(String handle, String name, List<String> args) {
        return handle + " := exec.Command(" + call(name, args) + ")";
    }

    @Override
    public String openPipe(String from, String pipe) {
        return pipe + ", err := " + from + ".StdoutPipe()";
    }

    @Override
    public String closePipe(String pipe) {
        // Wait closes the pipe again and ignores the error
        return pipe + ".Close()";
    }

    @Override
    public String bindInput(String to, String source) {
        return to + ".Stdin = " + source;
    }

    @Override
    public String bindOutput(String handle, String sink) {
        return handle + ".Stdout = " + sink;
    }

    @Override
    public String bindErrors(String handle, String sink) {
        return handle + ".Stderr = " + sink;
    }

    @Override
    public String start(String handle) {
        return handle + ".Start()";
    }

    @Override
    public String await(String handle) {
        return handle + ".Wait()";
    }

    @Override
    public String runAndCapture(String name, List<String> args) {
        return "runCommand(" + call(name, args) + ")";
    }

    @Override
    public String runForStatus(String name, List<String> args) {
        return "commandSucceeds(" + call(name, args) + ")";
    }

    private static String call(String name, List<String> args) {
        StringBuilder sb = new StringBuilder(name);
        for (String arg : args) {
            sb.append(", ").append(arg);
        }
        return sb.toString();
    }
}
