package org.shellgo.compiler.backend.build;

import org.shellgo.compiler.api.BuildToolFailureException;
import org.shellgo.junit.extensions.logging.AllowLog;
import org.shellgo.junit.extensions.logging.LogLevel;
import org.shellgo.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests the build driver's step sequence against a mocked Go tool.
 */
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
@MockitoSettings(strictness = Strictness.LENIENT)
@AllowLog(level = LogLevel.WARN, messagePattern = "Could not mark .* as executable")
public class BuildDriverTest {

    private static final String SOURCE = "package main\n\nfunc main() {}\n";

    @TempDir
    Path temp;

    @Mock
    private ToolRunner tools;

    private BuildDriver driver;
    private BuildOptions options;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        driver = new BuildDriver(tools);
        options = BuildOptions.defaults().withWorkspaceRoot(temp.resolve("work"));
        output = temp.resolve("bin").resolve("hello");
        when(tools.run(anyList(), any(Path.class), any(Duration.class))).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            Path dir = invocation.getArgument(1);
            if (command.contains("build")) {
                Files.writeString(dir.resolve("program"), "binary");
            }
            return new ToolResult(0, "", false);
        });
    }

    /**
     * The three Go commands run in order in the workspace holding the source,
     * and the artifact ends up at the requested path.
     */
    @Test
    @Tag("unit")
    void successfulBuildRelocatesTheArtifact() throws Exception {
        // Arrange
        ArgumentCaptor<Path> dirs = ArgumentCaptor.forClass(Path.class);

        // Act
        Path workspace = driver.stageAndBuild(SOURCE, output, options);

        // Assert
        InOrder order = inOrder(tools);
        order.verify(tools).run(eq(List.of("go", "mod", "init", "shellgo/script")), dirs.capture(), eq(Duration.ofMinutes(5)));
        order.verify(tools).run(eq(List.of("go", "mod", "tidy")), any(Path.class), any(Duration.class));
        order.verify(tools).run(eq(List.of("go", "build", "-o", "program", "main.go")), any(Path.class), any(Duration.class));
        assertThat(dirs.getValue()).isEqualTo(workspace);
        assertThat(workspace.getParent()).isEqualTo(temp.resolve("work"));
        assertThat(output).hasContent("binary");
    }

    @Test
    @Tag("unit")
    void workspaceIsDeletedByDefault() throws Exception {
        Path workspace = driver.stageAndBuild(SOURCE, output, options);

        assertThat(workspace).doesNotExist();
        assertThat(listing(temp.resolve("work"))).isEmpty();
    }

    @Test
    @Tag("unit")
    void workspaceIsKeptOnRequest() throws Exception {
        Path workspace = driver.stageAndBuild(SOURCE, output, options.withKeepWorkspace(true));

        assertThat(workspace.resolve("main.go")).hasContent(SOURCE);
        assertThat(workspace.resolve("program")).doesNotExist();
    }

    /**
     * A failing manifest step stops the build before compilation and carries the
     * tool's output verbatim.
     */
    @Test
    @Tag("unit")
    void manifestFailureKeepsToolOutput() throws Exception {
        // Arrange
        String diagnostics = "go: example.com/missing@v1.0.0: reading module: 404 Not Found\n";
        doReturn(new ToolResult(1, diagnostics, false))
                .when(tools).run(eq(List.of("go", "mod", "tidy")), any(Path.class), any(Duration.class));

        // Act & Assert
        assertThatThrownBy(() -> driver.stageAndBuild(SOURCE, output, options))
                .isInstanceOfSatisfying(BuildToolFailureException.class, e -> {
                    assertThat(e.step()).isEqualTo(BuildDriver.STEP_MANIFEST);
                    assertThat(e.toolOutput()).isEqualTo(diagnostics);
                    assertThat(e.getMessage()).startsWith("manifest: 'go mod tidy' failed with exit code 1")
                            .contains("404 Not Found");
                });
        verify(tools, never()).run(eq(List.of("go", "build", "-o", "program", "main.go")), any(Path.class), any(Duration.class));
        assertThat(output).doesNotExist();
        assertThat(listing(temp.resolve("work"))).isEmpty();
    }

    @Test
    @Tag("unit")
    void compileFailureIsReportedAsCompileStep() throws Exception {
        doReturn(new ToolResult(2, "./main.go:3:1: syntax error\n", false))
                .when(tools).run(eq(List.of("go", "build", "-o", "program", "main.go")), any(Path.class), any(Duration.class));

        assertThatThrownBy(() -> driver.stageAndBuild(SOURCE, output, options))
                .isInstanceOfSatisfying(BuildToolFailureException.class, e -> {
                    assertThat(e.step()).isEqualTo(BuildDriver.STEP_COMPILE);
                    assertThat(e.toolOutput()).contains("syntax error");
                });
        assertThat(output).doesNotExist();
    }

    @Test
    @Tag("unit")
    void timeoutFailsTheStep() throws Exception {
        doReturn(new ToolResult(-1, "", true))
                .when(tools).run(eq(List.of("go", "mod", "init", "shellgo/script")), any(Path.class), any(Duration.class));

        assertThatThrownBy(() -> driver.stageAndBuild(SOURCE, output, options))
                .isInstanceOf(BuildToolFailureException.class)
                .hasMessageContaining("timed out after PT5M");
        verify(tools, times(1)).run(anyList(), any(Path.class), any(Duration.class));
    }

    @Test
    @Tag("unit")
    void missingToolIsReportedWithItsStep() throws Exception {
        doThrow(new IOException("Cannot run program \"go\": error=2, No such file or directory"))
                .when(tools).run(anyList(), any(Path.class), any(Duration.class));

        assertThatThrownBy(() -> driver.stageAndBuild(SOURCE, output, options))
                .isInstanceOfSatisfying(BuildToolFailureException.class, e -> {
                    assertThat(e.step()).isEqualTo(BuildDriver.STEP_MANIFEST);
                    assertThat(e.getCause()).isInstanceOf(IOException.class);
                });
    }

    @Test
    @Tag("unit")
    void missingArtifactFailsRelocation() throws Exception {
        doReturn(new ToolResult(0, "", false)).when(tools).run(anyList(), any(Path.class), any(Duration.class));

        assertThatThrownBy(() -> driver.stageAndBuild(SOURCE, output, options))
                .isInstanceOfSatisfying(BuildToolFailureException.class,
                        e -> assertThat(e.step()).isEqualTo(BuildDriver.STEP_RELOCATE))
                .hasMessageContaining("the compiler produced no artifact");
        assertThat(output).doesNotExist();
    }

    @Test
    @Tag("unit")
    void existingOutputIsReplaced() throws Exception {
        Files.createDirectories(output.getParent());
        Files.writeString(output, "old");

        driver.stageAndBuild(SOURCE, output, options);

        assertThat(output).hasContent("binary");
    }

    private static List<Path> listing(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.toList();
        }
    }
}
