package org.shellgo.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.shellgo.compiler.backend.build.BuildOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests loading the HOCON configuration and its typed view.
 */
public class ShellgoSettingsTest {

    @TempDir
    Path temp;

    /**
     * Without any configuration file the reference defaults equal the built-in build options.
     */
    @Test
    @Tag("unit")
    void referenceDefaultsMatchBuiltInOptions() {
        ShellgoSettings settings = ShellgoSettings.from(ConfigFactory.defaultReference());

        assertThat(settings.processBackend()).isEqualTo("os-exec");
        assertThat(settings.buildOptions()).isEqualTo(BuildOptions.defaults());
    }

    @Test
    @Tag("unit")
    void fileOverridesDefaults() throws Exception {
        // Arrange
        Path file = temp.resolve("custom.conf");
        Files.writeString(file, String.join("\n",
                "shellgo {",
                "  build {",
                "    go-executable = \"/usr/local/go/bin/go\"",
                "    timeout = 90s",
                "    keep-workspace = true",
                "    workspace-root = \"" + temp.resolve("work") + "\"",
                "  }",
                "}",
                ""));

        // Act
        Config config = ConfigLoader.load(file.toFile());
        ShellgoSettings settings = ShellgoSettings.from(config);

        // Assert
        BuildOptions options = settings.buildOptions();
        assertThat(options.goExecutable()).isEqualTo("/usr/local/go/bin/go");
        assertThat(options.timeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(options.keepWorkspace()).isTrue();
        assertThat(options.workspaceRoot()).isEqualTo(temp.resolve("work"));
        assertThat(options.moduleName()).isEqualTo("shellgo/script");
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    @Test
    @Tag("unit")
    void missingExplicitFileIsRejected() {
        File absent = temp.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(absent))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Configuration file not found: ");
    }

    @Test
    @Tag("unit")
    void wrongValueTypeIsRejected() {
        Config config = ConfigFactory.parseString("shellgo.build.timeout = soon")
                .withFallback(ConfigFactory.defaultReference());

        assertThatThrownBy(() -> ShellgoSettings.from(config)).isInstanceOf(ConfigException.BadValue.class);
    }
}
