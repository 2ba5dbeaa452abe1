package org.shellgo.cli.commands;

import org.shellgo.cli.CommandLineInterface;
import org.shellgo.compiler.Compiler;
import org.shellgo.compiler.api.CompilationException;
import org.shellgo.compiler.ir.IrProgram;
import org.shellgo.compiler.util.AtomicFiles;
import org.shellgo.compiler.util.IrDumper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "convert", description = "Translates a shell script into a Go source file.")
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "SCRIPT", description = "The shell script to translate.")
    private Path script;

    @Option(names = {"-o", "--output"}, required = true, paramLabel = "FILE", description = "The Go source file to write.")
    private Path output;

    @Option(names = "--dump-ir", paramLabel = "FILE", description = "Also write the intermediate representation as JSON.")
    private Path dumpIr;

    @Override
    public Integer call() {
        try {
            final String text = Files.readString(script);
            final Compiler compiler = parent.createCompiler(parent.settings().buildOptions());
            final IrProgram program = compiler.buildIr(text, script.toString());
            if (dumpIr != null) {
                IrDumper.dump(program, dumpIr);
                log.info("Wrote IR of {} to {}", script, dumpIr);
            }
            final String source = compiler.generate(program);
            AtomicFiles.writeString(output, source);
            log.info("Wrote {}", output);
            return 0;
        } catch (CompilationException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: " + describe(e));
            return 1;
        }
    }

    static String describe(IOException e) {
        if (e instanceof NoSuchFileException missing) {
            return "no such file: " + missing.getFile();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
