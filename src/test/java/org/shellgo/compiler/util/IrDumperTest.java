package org.shellgo.compiler.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.shellgo.compiler.Compiler;
import org.shellgo.compiler.ir.IrProgram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the JSON dump of IR programs and the atomic file writer behind the CLI output.
 */
@Tag("unit")
public class IrDumperTest {

    @TempDir
    Path temp;

    @Test
    void statementsAreTaggedWithTheirKind() throws Exception {
        IrProgram program = new Compiler().buildIr("X=1\nif [ -f a ]; then echo $X; fi\n", "dump.sh");

        JsonObject json = JsonParser.parseString(IrDumper.toJson(program)).getAsJsonObject();

        assertThat(json.get("programName").getAsString()).isEqualTo("dump.sh");
        JsonArray statements = json.getAsJsonArray("statements");
        assertThat(statements).hasSize(2);
        JsonObject assignment = statements.get(0).getAsJsonObject();
        assertThat(assignment.keySet().iterator().next()).isEqualTo("kind");
        assertThat(assignment.get("kind").getAsString()).isEqualTo("ASSIGNMENT");
        JsonObject conditional = statements.get(1).getAsJsonObject();
        assertThat(conditional.get("kind").getAsString()).isEqualTo("CONDITIONAL");
        assertThat(conditional.get("category").getAsString()).isEqualTo("FILE_TEST");
        assertThat(conditional.getAsJsonArray("thenBranch").get(0).getAsJsonObject().get("kind").getAsString())
                .isEqualTo("COMMAND");
    }

    @Test
    void dumpCreatesParentDirectories() throws Exception {
        IrProgram program = new Compiler().buildIr("echo hi\n", "hi.sh");
        Path file = temp.resolve("ir").resolve("hi.json");

        IrDumper.dump(program, file);

        assertThat(Files.readString(file)).startsWith("{").endsWith("}\n").contains("\"kind\": \"COMMAND\"");
    }

    @Test
    void atomicWriteReplacesContentAndLeavesNoTemporaryFiles() throws Exception {
        Path target = temp.resolve("out").resolve("main.go");

        AtomicFiles.writeString(target, "first");
        AtomicFiles.writeString(target, "second");

        assertThat(target).hasContent("second");
        try (var entries = Files.list(target.getParent())) {
            assertThat(entries).containsExactly(target);
        }
    }
}
