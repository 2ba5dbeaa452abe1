package org.shellgo.compiler.backend.build;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of one build.
 *
 * @param goExecutable The Go tool, a name on the {@code PATH} or an absolute path.
 * @param moduleName The module path passed to {@code go mod init}.
 * @param sourceFileName The file name of the generated source inside the workspace.
 * @param timeout The limit for each tool invocation.
 * @param keepWorkspace Whether the workspace survives the build.
 * @param workspaceRoot The directory workspaces are created in, or {@code null} for the system temporary directory.
 */
public record BuildOptions(
        String goExecutable,
        String moduleName,
        String sourceFileName,
        Duration timeout,
        boolean keepWorkspace,
        Path workspaceRoot
) {

    /**
     * @return The settings used when nothing is configured.
     */
    public static BuildOptions defaults() {
        return new BuildOptions("go", "shellgo/script", "main.go", Duration.ofMinutes(5), false, null);
    }

    /**
     * @param keep Whether the workspace survives the build.
     * @return A copy with the retention flag replaced.
     */
    public BuildOptions withKeepWorkspace(boolean keep) {
        return new BuildOptions(goExecutable, moduleName, sourceFileName, timeout, keep, workspaceRoot);
    }

    /**
     * @param root The directory workspaces are created in.
     * @return A copy with the workspace root replaced.
     */
    public BuildOptions withWorkspaceRoot(Path root) {
        return new BuildOptions(goExecutable, moduleName, sourceFileName, timeout, keepWorkspace, root);
    }
}
