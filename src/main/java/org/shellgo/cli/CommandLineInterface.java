package org.shellgo.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.shellgo.cli.commands.BuildCommand;
import org.shellgo.cli.commands.ConvertCommand;
import org.shellgo.cli.config.ConfigLoader;
import org.shellgo.cli.config.LoggingConfigurator;
import org.shellgo.cli.config.ShellgoSettings;
import org.shellgo.compiler.Compiler;
import org.shellgo.compiler.backend.build.BuildDriver;
import org.shellgo.compiler.backend.build.BuildOptions;
import org.shellgo.compiler.backend.emit.process.ProcessBackends;
import org.shellgo.compiler.diagnostics.CompilerLogger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "shellgo",
    mixinStandardHelpOptions = true,
    version = "shellgo 1.0",
    description = "shellgo - translates shell scripts into Go programs and standalone executables",
    subcommands = {
        ConvertCommand.class,
        BuildCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log the compiler phases and the build tool output.")
    private boolean verbose;

    private ShellgoSettings settings;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("shellgo");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration once and applies its logging section.
     *
     * @return The typed settings.
     * @throws IllegalArgumentException if the configuration file is missing or invalid.
     */
    public ShellgoSettings settings() {
        if (settings != null) {
            return settings;
        }
        try {
            final Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            if (verbose) {
                LoggingConfigurator.setLevel("org.shellgo", "DEBUG");
            }
            settings = ShellgoSettings.from(config);
            ProcessBackends.byName(settings.processBackend());
            return settings;
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @param buildOptions The build settings to use.
     * @return A compiler wired from the configuration.
     */
    public Compiler createCompiler(final BuildOptions buildOptions) {
        final Compiler compiler = new Compiler(
                ProcessBackends.byName(settings().processBackend()), new BuildDriver(), buildOptions);
        if (verbose) {
            compiler.setVerbosity(CompilerLogger.DEBUG);
        }
        return compiler;
    }
}
