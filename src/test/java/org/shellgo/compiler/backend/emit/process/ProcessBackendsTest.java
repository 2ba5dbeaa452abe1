package org.shellgo.compiler.backend.emit.process;

import org.shellgo.compiler.backend.emit.RuntimeHelper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ProcessBackendsTest {

    @Test
    void resolvesTheOsExecBackendByName() {
        ProcessBackend backend = ProcessBackends.byName(OsExecProcessBackend.NAME);

        assertThat(backend.name()).isEqualTo("os-exec");
        assertThat(ProcessBackends.defaultBackend().name()).isEqualTo("os-exec");
    }

    @Test
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> ProcessBackends.byName("fork"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown process backend 'fork'");
    }

    @Test
    void osExecCallsAndHelpers() {
        ProcessBackend backend = new OsExecProcessBackend();

        assertThat(backend.spawn("stage0", "\"ls\"", List.of("\"-l\""))).isEqualTo("stage0 := exec.Command(\"ls\", \"-l\")");
        assertThat(backend.closePipe("pipe0")).isEqualTo("pipe0.Close()");
        assertThat(backend.runAndCapture("\"go\"", List.of())).isEqualTo("runCommand(\"go\")");
        assertThat(backend.runForStatus("\"grep\"", List.of("\"-q\"", "v_x"))).isEqualTo("commandSucceeds(\"grep\", \"-q\", v_x)");
        assertThat(backend.helperSource(RuntimeHelper.RUN_COMMAND)).startsWith("func runCommand(name string, args ...string) error {");
        assertThat(backend.helperImports(RuntimeHelper.COMMAND_SUCCEEDS)).containsExactlyInAnyOrder("os", "os/exec");
        assertThatThrownBy(() -> backend.helperSource(RuntimeHelper.ARG)).isInstanceOf(IllegalArgumentException.class);
    }
}
