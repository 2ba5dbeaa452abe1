package org.shellgo.compiler.frontend;

import org.shellgo.compiler.Compiler;
import org.shellgo.compiler.api.CompilationException;
import org.shellgo.compiler.api.MalformedSourceException;
import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.ir.Capability;
import org.shellgo.compiler.ir.CommandClass;
import org.shellgo.compiler.ir.ConditionCategory;
import org.shellgo.compiler.ir.IrAssignment;
import org.shellgo.compiler.ir.IrBackground;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrConditional;
import org.shellgo.compiler.ir.IrFunction;
import org.shellgo.compiler.ir.IrFunctionDecl;
import org.shellgo.compiler.ir.IrLoop;
import org.shellgo.compiler.ir.IrPipeline;
import org.shellgo.compiler.ir.IrProgram;
import org.shellgo.compiler.ir.IrRedirection;
import org.shellgo.compiler.ir.IrSubshell;
import org.shellgo.compiler.ir.LoopKind;
import org.shellgo.compiler.ir.RedirectOperator;
import org.shellgo.junit.extensions.logging.ExpectLog;
import org.shellgo.junit.extensions.logging.LogLevel;
import org.shellgo.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the IR builder on complete scripts: statement shapes, the function and
 * variable tables, capabilities and the constructs it rejects.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class IrGeneratorTest {

    private static IrProgram build(String script) throws CompilationException {
        return new Compiler().buildIr(script, "script.sh");
    }

    @Test
    void assignmentAndEchoInterpolateTheVariable() throws Exception {
        IrProgram program = build("NAME=World\necho \"Hello, $NAME\"\n");

        assertThat(program.programName()).isEqualTo("script.sh");
        assertThat(program.statements()).containsExactly(
                new IrAssignment("NAME", "World", false, false, program.statements().get(0).source()),
                IrCommand.of("echo", List.of("Hello, ${NAME}"), CommandClass.BUILTIN, program.statements().get(1).source()));
        assertThat(program.variables()).containsEntry("NAME", "World");
        assertThat(program.capabilities()).isEmpty();
    }

    @Test
    void fileTestConditionIsCategorized() throws Exception {
        IrProgram program = build("if [ -f go.mod ]; then\n  echo \"Go module found\"\nfi\n");

        IrConditional conditional = (IrConditional) program.statements().get(0);
        assertThat(conditional.category()).isEqualTo(ConditionCategory.FILE_TEST);
        assertThat(conditional.condition()).hasSize(1);
        IrCommand test = (IrCommand) conditional.condition().get(0);
        assertThat(test.name()).isEqualTo("[");
        assertThat(test.args()).containsExactly("-f", "go.mod", "]");
        assertThat(conditional.thenBranch()).hasSize(1);
        assertThat(conditional.elseBranch()).isEmpty();
        assertThat(program.requires(Capability.FILESYSTEM)).isTrue();
    }

    @Test
    void pipelineKeepsStageOrder() throws Exception {
        IrProgram program = build("ls -la | grep \".sh\" | wc -l\n");

        IrPipeline pipeline = (IrPipeline) program.statements().get(0);
        assertThat(pipeline.commands()).extracting(IrCommand::name).containsExactly("ls", "grep", "wc");
        assertThat(pipeline.commands()).extracting(IrCommand::commandClass).containsOnly(CommandClass.EXTERNAL);
        assertThat(pipeline.commands().get(1).args()).containsExactly(".sh");
        assertThat(pipeline.commands()).allMatch(IrCommand::useProcessHelper);
        assertThat(program.requires(Capability.PROCESS_EXECUTION)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 9})
    void pipeDepthGivesOneMoreStage(int pipes) throws Exception {
        List<String> stages = new ArrayList<>(Collections.nCopies(pipes + 1, "cat"));

        IrProgram program = build(String.join(" | ", stages));

        assertThat(((IrPipeline) program.statements().get(0)).commands()).hasSize(pipes + 1);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 3, 6})
    void elifChainIsFlattenedInOrder(int elifs) throws Exception {
        StringBuilder script = new StringBuilder("if [ \"$1\" = a ]; then echo a\n");
        for (int i = 0; i < elifs; i++) {
            script.append("elif [ \"$1\" = e").append(i).append(" ]; then echo e").append(i).append('\n');
        }
        script.append("else echo none\nfi\n");

        IrConditional conditional = (IrConditional) build(script.toString()).statements().get(0);

        assertThat(conditional.elifBranches()).hasSize(elifs);
        for (int i = 0; i < elifs; i++) {
            IrCommand echo = (IrCommand) conditional.elifBranches().get(i).body().get(0);
            assertThat(echo.args()).containsExactly("e" + i);
            assertThat(conditional.elifBranches().get(i).category()).isEqualTo(ConditionCategory.STRING_TEST);
        }
        assertThat(conditional.elseBranch()).hasSize(1);
    }

    @Test
    void andOrListsBecomeConditionals() throws Exception {
        IrProgram program = build("mkdir -p out && echo made\ntest -d out || echo missing\n");

        IrConditional and = (IrConditional) program.statements().get(0);
        assertThat(and.thenBranch()).hasSize(1);
        assertThat(and.elseBranch()).isEmpty();
        IrConditional or = (IrConditional) program.statements().get(1);
        assertThat(or.thenBranch()).isEmpty();
        assertThat(or.elseBranch()).hasSize(1);
        assertThat(or.category()).isEqualTo(ConditionCategory.FILE_TEST);
    }

    @Test
    void functionsHaveLocalsAndParameters() throws Exception {
        IrProgram program = build(String.join("\n",
                "greet() {",
                "  local who=$1",
                "  echo \"hi $who from $2\"",
                "}",
                "greet bob alice",
                ""));

        assertThat(program.statements().get(0)).isInstanceOf(IrFunctionDecl.class);
        IrFunction greet = program.functions().get("greet");
        assertThat(greet.locals()).containsEntry("who", "${1}");
        assertThat(greet.parameters()).containsExactly("1", "2");
        assertThat(((IrAssignment) greet.body().get(0)).local()).isTrue();
        assertThat(program.variables()).doesNotContainKey("who");
        IrCommand call = (IrCommand) program.statements().get(1);
        assertThat(call.commandClass()).isEqualTo(CommandClass.FUNCTION);
        assertThat(call.useProcessHelper()).isFalse();
    }

    @Test
    void braceRangesBecomeCountedLoops() throws Exception {
        IrProgram program = build("for i in {1..3}; do echo $i; done\nfor j in {3..1}; do echo $j; done\n");

        IrLoop ascending = (IrLoop) program.statements().get(0);
        assertThat(ascending.loopKind()).isEqualTo(LoopKind.COUNTED_RANGE);
        assertThat(ascending.range()).isEqualTo(new IrLoop.Range(1, 3));
        IrLoop descending = (IrLoop) program.statements().get(1);
        assertThat(descending.loopKind()).isEqualTo(LoopKind.ITERATE_LIST);
        assertThat(descending.items()).isEqualTo("3 2 1");
        assertThat(program.variables()).containsKeys("i", "j");
    }

    @Test
    void forWithoutListIteratesArguments() throws Exception {
        IrLoop loop = (IrLoop) build("for a; do echo $a; done\n").statements().get(0);

        assertThat(loop.loopKind()).isEqualTo(LoopKind.ITERATE_LIST);
        assertThat(loop.items()).isEqualTo("${@}");
    }

    @Test
    void redirectionsWrapTheStatement() throws Exception {
        IrProgram program = build("echo hi > out.txt\nsort < in.txt >> sorted.txt\n");

        IrRedirection write = (IrRedirection) program.statements().get(0);
        assertThat(write.operator()).isEqualTo(RedirectOperator.TRUNCATE_WRITE);
        assertThat(write.target()).isEqualTo("out.txt");
        assertThat(write.statement()).isInstanceOf(IrCommand.class);
        IrRedirection outer = (IrRedirection) program.statements().get(1);
        assertThat(outer.operator()).isEqualTo(RedirectOperator.READ);
        assertThat(((IrRedirection) outer.statement()).operator()).isEqualTo(RedirectOperator.APPEND_WRITE);
    }

    @Test
    void backgroundAndSubshellStatements() throws Exception {
        IrProgram program = build("sleep 1 &\n(cd /tmp; ls)\nwait\n");

        assertThat(program.statements().get(0)).isInstanceOf(IrBackground.class);
        assertThat(((IrSubshell) program.statements().get(1)).statements()).hasSize(2);
        assertThat(program.capabilities()).contains(
                Capability.BACKGROUND_JOBS, Capability.WORKING_DIRECTORY, Capability.PROCESS_EXECUTION);
    }

    @Test
    void readDeclaresItsTargets() throws Exception {
        IrProgram program = build("read -r first rest\nread\n");

        assertThat(program.variables()).containsKeys("first", "rest", "REPLY");
        assertThat(program.requires(Capability.STANDARD_INPUT)).isTrue();
    }

    @Test
    void functionBodiesMayCallFunctionsDefinedLater() throws Exception {
        IrProgram program = build("a() { b; }\nb() { echo hi; }\na\n");

        IrCommand call = (IrCommand) program.functions().get("a").body().get(0);
        assertThat(call.commandClass()).isEqualTo(CommandClass.FUNCTION);
        assertThat(((IrCommand) program.statements().get(2)).commandClass()).isEqualTo(CommandClass.FUNCTION);
    }

    @Test
    void topLevelCallBeforeTheDefinitionStaysExternal() throws Exception {
        IrProgram program = build("b\nb() { echo hi; }\n");

        IrCommand call = (IrCommand) program.statements().get(0);
        assertThat(call.commandClass()).isEqualTo(CommandClass.EXTERNAL);
        assertThat(call.useProcessHelper()).isTrue();
    }

    @Test
    void highestAcceptedPositionalParameterIsRecorded() throws Exception {
        IrFunction f = build("f() { echo ${255}; }\n").functions().get("f");

        assertThat(f.parameters()).hasSize(255).endsWith("255");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "\\[WARNING\\] script.sh:2: 'readonly' is converted to a plain assignment.*")
    void readonlyIsKeptAsAnAssignmentWithAWarning() throws Exception {
        IrProgram program = build("echo start\nreadonly MODE=fast\n");

        assertThat(program.variables()).containsEntry("MODE", "fast");
    }

    @Test
    void commandSubstitutionIsAnOpaqueMarker() throws Exception {
        IrCommand echo = (IrCommand) build("echo \"today: $(date)\"\n").statements().get(0);

        assertThat(echo.args()).containsExactly("today: $(command)");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "case $x in a) echo a ;; esac|case statement",
            "echo $((1 + 2))|arithmetic expansion",
            "[[ -f x ]]|test expression '[[ ... ]]'",
            "eval ls|command 'eval'",
            "ls 2>&1|descriptor redirection",
            "echo ${x:-default}|parameter expansion",
            "echo $?|special parameter $?",
            "! true|negated command",
            "(( i++ ))|arithmetic command",
            "f() { g() { true; }; }|nested function definition",
            "cat <<< word|here-string",
            "echo ${99999999999}|positional parameter ${99999999999}",
            "f() { echo ${256}; }|positional parameter ${256}",
            "f() { true; }; f() { false; }|redefinition of function 'f'"
    })
    void unsupportedConstructsFailTheWholeConversion(String script, String kind) {
        assertThatThrownBy(() -> build(script + "\n"))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageStartingWith("Unsupported construct: ")
                .satisfies(e -> assertThat(((UnsupportedConstructException) e).kind()).startsWith(kind));
    }

    @Test
    void malformedScriptReportsDiagnostics() {
        assertThatThrownBy(() -> build("if true; then echo x\n"))
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("script.sh:2")
                .hasMessageContaining("Expected 'fi'");
    }
}
