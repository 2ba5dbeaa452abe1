package org.shellgo.cli.config;

import com.typesafe.config.Config;
import org.shellgo.compiler.backend.build.BuildOptions;

import java.nio.file.Path;

/**
 * Typed view of the {@code shellgo} configuration section.
 *
 * @param processBackend Name of the process backend of generated programs.
 * @param buildOptions The build settings.
 */
public record ShellgoSettings(String processBackend, BuildOptions buildOptions) {

    /**
     * @param config The merged configuration, including {@code reference.conf}.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type.
     */
    public static ShellgoSettings from(Config config) {
        Config shellgo = config.getConfig("shellgo");
        Config build = shellgo.getConfig("build");
        String root = build.hasPath("workspace-root") ? build.getString("workspace-root") : "";
        BuildOptions options = new BuildOptions(
                build.getString("go-executable"),
                build.getString("module-name"),
                build.getString("source-file"),
                build.getDuration("timeout"),
                build.getBoolean("keep-workspace"),
                root.isBlank() ? null : Path.of(root));
        return new ShellgoSettings(shellgo.getString("generator.process-backend"), options);
    }
}
