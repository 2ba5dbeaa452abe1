package org.shellgo.cli;

import org.shellgo.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code shellgo} command line in-process and checks exit codes,
 * written files and error reporting.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class CommandLineInterfaceTest {

    @TempDir
    Path temp;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new CommandLineInterface());
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private Path script(String name, String text) throws Exception {
        Path file = temp.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    @Test
    void convertWritesGoSource() throws Exception {
        Path script = script("hello.sh", "#!/bin/sh\nNAME=World\necho \"Hello, $NAME\"\n");
        Path output = temp.resolve("out").resolve("main.go");

        int exitCode = commandLine.execute("convert", script.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(err.toString()).isEmpty();
        assertThat(Files.readString(output))
                .startsWith("// Code generated by shellgo from hello.sh. DO NOT EDIT.")
                .contains("fmt.Println(\"Hello, \" + v_NAME)");
    }

    @Test
    void convertDumpsIrOnRequest() throws Exception {
        Path script = script("ls.sh", "ls -la | wc -l\n");
        Path ir = temp.resolve("ls.json");

        int exitCode = commandLine.execute("convert", script.toString(), "-o", temp.resolve("main.go").toString(),
                "--dump-ir", ir.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(ir))
                .contains("\"programName\": \"ls.sh\"")
                .contains("\"kind\": \"PIPELINE\"")
                .contains("\"kind\": \"COMMAND\"");
    }

    @Test
    void missingScriptFailsWithExitCodeOne() {
        Path output = temp.resolve("main.go");

        int exitCode = commandLine.execute("convert", temp.resolve("absent.sh").toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: no such file: ").contains("absent.sh");
        assertThat(output).doesNotExist();
    }

    @Test
    void unsupportedConstructFailsWithoutOutput() throws Exception {
        Path script = script("case.sh", "case $1 in\n  a) echo a ;;\nesac\n");
        Path output = temp.resolve("main.go");

        int exitCode = commandLine.execute("convert", script.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: Unsupported construct: case statement");
        assertThat(output).doesNotExist();
    }

    @Test
    void malformedScriptReportsLocation() throws Exception {
        Path script = script("broken.sh", "if true; then\n  echo x\n");

        int exitCode = commandLine.execute("convert", script.toString(), "-o", temp.resolve("main.go").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: ").contains("broken.sh:");
    }

    @Test
    void missingConfigurationFileIsReported() throws Exception {
        Path script = script("hello.sh", "echo hi\n");

        int exitCode = commandLine.execute("-c", temp.resolve("absent.conf").toString(),
                "convert", script.toString(), "-o", temp.resolve("main.go").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: Configuration file not found: ");
    }

    @Test
    void unknownProcessBackendIsReported() throws Exception {
        Path config = script("shellgo.conf", "shellgo.generator.process-backend = \"fork\"\n");
        Path script = script("hello.sh", "echo hi\n");

        int exitCode = commandLine.execute("-c", config.toString(),
                "convert", script.toString(), "-o", temp.resolve("main.go").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: Unknown process backend 'fork'");
    }

    @Test
    void buildReportsAMissingGoTool() throws Exception {
        Path work = temp.resolve("work");
        Path config = script("shellgo.conf", String.join("\n",
                "shellgo.build.go-executable = \"" + temp.resolve("no-such-go") + "\"",
                "shellgo.build.workspace-root = \"" + work + "\"",
                ""));
        Path script = script("hello.sh", "echo hi\n");
        Path output = temp.resolve("hello");

        int exitCode = commandLine.execute("-c", config.toString(), "build", script.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: manifest: cannot run ");
        assertThat(output).doesNotExist();
        try (var entries = Files.list(work)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void helpListsTheSubcommands() {
        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("shellgo", "convert", "build");
    }
}
