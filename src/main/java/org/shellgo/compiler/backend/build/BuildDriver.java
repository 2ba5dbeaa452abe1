package org.shellgo.compiler.backend.build;

import org.shellgo.compiler.api.BuildToolFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Turns generated Go source into an executable.
 * <p>
 * Every build gets its own workspace directory. The steps run in order and each
 * one is a hard failure: workspace setup, manifest resolution ({@code go mod init}
 * and {@code go mod tidy}), compilation ({@code go build}) and relocation of the
 * artifact to the requested path. The workspace is deleted afterwards, whether the
 * build succeeded or not, unless retention was requested.
 */
public final class BuildDriver {

    private static final Logger log = LoggerFactory.getLogger(BuildDriver.class);

    /** Step names reported in {@link BuildToolFailureException#step()}. */
    public static final String STEP_WORKSPACE = "workspace";
    public static final String STEP_MANIFEST = "manifest";
    public static final String STEP_COMPILE = "compile";
    public static final String STEP_RELOCATE = "relocate";

    private static final String ARTIFACT_NAME = "program";

    private final ToolRunner tools;

    /**
     * @param tools The runner invoking the Go tool.
     */
    public BuildDriver(ToolRunner tools) {
        this.tools = tools;
    }

    /**
     * Creates a driver that starts real processes.
     */
    public BuildDriver() {
        this(new ProcessToolRunner());
    }

    /**
     * Builds an executable from Go source.
     *
     * @param source The Go source of package {@code main}.
     * @param outputPath Where the executable is placed; an existing file is replaced.
     * @param options The build settings.
     * @return The workspace directory that was used. It no longer exists unless it was kept.
     * @throws BuildToolFailureException if any step fails. Nothing is written to {@code outputPath} then.
     */
    public Path stageAndBuild(String source, Path outputPath, BuildOptions options) throws BuildToolFailureException {
        Path workspace = createWorkspace(source, options);
        try {
            log.info("Building {} in {}", outputPath.getFileName(), workspace);
            runStep(STEP_MANIFEST, List.of(options.goExecutable(), "mod", "init", options.moduleName()), workspace, options);
            runStep(STEP_MANIFEST, List.of(options.goExecutable(), "mod", "tidy"), workspace, options);
            runStep(STEP_COMPILE, List.of(options.goExecutable(), "build", "-o", ARTIFACT_NAME, options.sourceFileName()),
                    workspace, options);
            relocate(workspace.resolve(ARTIFACT_NAME), outputPath);
            log.info("Built {}", outputPath);
            return workspace;
        } finally {
            if (options.keepWorkspace()) {
                log.info("Kept workspace {}", workspace);
            } else {
                deleteWorkspace(workspace);
            }
        }
    }

    private static Path createWorkspace(String source, BuildOptions options) throws BuildToolFailureException {
        Path workspace = null;
        try {
            if (options.workspaceRoot() != null) {
                Files.createDirectories(options.workspaceRoot());
                workspace = Files.createTempDirectory(options.workspaceRoot(), "shellgo-");
            } else {
                workspace = Files.createTempDirectory("shellgo-");
            }
            Files.writeString(workspace.resolve(options.sourceFileName()), source, StandardCharsets.UTF_8);
            log.debug("Staged {} in {}", options.sourceFileName(), workspace);
            return workspace;
        } catch (IOException e) {
            if (workspace != null && !options.keepWorkspace()) {
                deleteWorkspace(workspace);
            }
            throw new BuildToolFailureException(STEP_WORKSPACE, "cannot set up the build workspace", e);
        }
    }

    private void runStep(String step, List<String> command, Path workspace, BuildOptions options)
            throws BuildToolFailureException {
        String description = String.join(" ", command);
        log.info("{}: {}", step, description);
        ToolResult result;
        try {
            result = tools.run(command, workspace, options.timeout());
        } catch (IOException e) {
            throw new BuildToolFailureException(step, "cannot run '" + description + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildToolFailureException(step, "interrupted while running '" + description + "'", e);
        }
        if (!result.output().isBlank()) {
            log.debug("{} output:\n{}", command.get(0), result.output().stripTrailing());
        }
        if (result.timedOut()) {
            throw new BuildToolFailureException(step, "'" + description + "' timed out after " + options.timeout(), result.output());
        }
        if (!result.succeeded()) {
            throw new BuildToolFailureException(step, "'" + description + "' failed with exit code " + result.exitCode(),
                    result.output());
        }
    }

    private static void relocate(Path artifact, Path outputPath) throws BuildToolFailureException {
        if (!Files.isRegularFile(artifact)) {
            throw new BuildToolFailureException(STEP_RELOCATE, "the compiler produced no artifact", "");
        }
        try {
            Path target = outputPath.toAbsolutePath();
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.move(artifact, target, StandardCopyOption.REPLACE_EXISTING);
            if (!target.toFile().setExecutable(true)) {
                log.warn("Could not mark {} as executable", target);
            }
        } catch (IOException e) {
            throw new BuildToolFailureException(STEP_RELOCATE, "cannot move the executable to " + outputPath, e);
        }
    }

    private static void deleteWorkspace(Path workspace) {
        try (Stream<Path> paths = Files.walk(workspace)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
            log.debug("Deleted workspace {}", workspace);
        } catch (IOException e) {
            log.warn("Could not delete workspace {}: {}", workspace, e.getMessage());
        }
    }
}
