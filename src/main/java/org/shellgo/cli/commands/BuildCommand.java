package org.shellgo.cli.commands;

import org.shellgo.cli.CommandLineInterface;
import org.shellgo.compiler.Compiler;
import org.shellgo.compiler.api.CompilationException;
import org.shellgo.compiler.backend.build.BuildOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "build", description = "Translates a shell script and compiles it into a standalone executable.")
public class BuildCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "SCRIPT", description = "The shell script to translate.")
    private Path script;

    @Option(names = {"-o", "--output"}, required = true, paramLabel = "BINARY", description = "The executable to write.")
    private Path output;

    @Option(names = "--keep-workspace", description = "Keep the build workspace for inspection.")
    private boolean keepWorkspace;

    @Option(names = "--workspace", paramLabel = "DIR", description = "Create the build workspace inside this directory.")
    private Path workspaceRoot;

    @Override
    public Integer call() {
        try {
            final String text = Files.readString(script);
            BuildOptions options = parent.settings().buildOptions();
            if (keepWorkspace) {
                options = options.withKeepWorkspace(true);
            }
            if (workspaceRoot != null) {
                options = options.withWorkspaceRoot(workspaceRoot);
            }
            final Compiler compiler = parent.createCompiler(options);
            compiler.build(text, script.toString(), output);
            return 0;
        } catch (CompilationException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: " + ConvertCommand.describe(e));
            return 1;
        }
    }
}
