package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.Compiler;
import org.shellgo.compiler.api.CompilationException;
import org.shellgo.compiler.api.UnsupportedConstructException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the Go code generator on complete scripts. The generated text is checked
 * for the fixed lowering patterns, the exact import list and determinism.
 */
@Tag("unit")
public class GoCodeGeneratorTest {

    private static String convert(String... lines) throws CompilationException {
        return new Compiler().convert(String.join("\n", lines) + "\n", "script.sh");
    }

    private static List<String> imports(String source) {
        int start = source.indexOf("import (\n") + "import (\n".length();
        int end = source.indexOf("\n)", start);
        return source.substring(start, end).lines().map(String::strip).toList();
    }

    @Test
    void variableAndEchoProgram() throws Exception {
        String go = convert("NAME=World", "echo \"Hello, $NAME\"");

        assertThat(go).startsWith("// Code generated by shellgo from script.sh. DO NOT EDIT.\n\npackage main\n");
        assertThat(imports(go)).containsExactly("\"errors\"", "\"fmt\"", "\"os\"");
        assertThat(go).contains("var v_NAME = os.Getenv(\"NAME\")\n");
        assertThat(go).contains("func run(args []string) error {\n\tv_NAME = \"World\"\n\tfmt.Println(\"Hello, \" + v_NAME)\n\treturn nil\n}\n");
        assertThat(go).contains("type exitStatus int");
        assertThat(go).contains("if errors.As(err, &status) {");
        assertThat(go).doesNotContain("runCommand");
    }

    @Test
    void fileTestUsesNativeCheck() throws Exception {
        String go = convert("if [ -f go.mod ]; then", "  echo \"Go module found\"", "fi");

        assertThat(go).contains("\tif isFile(\"go.mod\") {\n\t\tfmt.Println(\"Go module found\")\n\t}\n");
        assertThat(go).contains("func isFile(path string) bool {");
        assertThat(go).doesNotContain("commandSucceeds").doesNotContain("exec.Command");
        assertThat(imports(go)).containsExactly("\"errors\"", "\"fmt\"", "\"os\"");
    }

    @Test
    void pipelineStartsEveryStageBeforeWaiting() throws Exception {
        String go = convert("ls -la | grep \".sh\" | wc -l");

        assertThat(go).contains(
                "stage0 := exec.Command(\"ls\", \"-la\")",
                "stage1 := exec.Command(\"grep\", \".sh\")",
                "stage2 := exec.Command(\"wc\", \"-l\")",
                "stage0.Stdin = os.Stdin",
                "pipe0, err := stage0.StdoutPipe()",
                "stage1.Stdin = pipe0",
                "stage2.Stdin = pipe1",
                "stage2.Stdout = os.Stdout");
        assertThat(go.indexOf("stage2.Start()")).isLessThan(go.indexOf("stage0.Wait()"));
        assertThat(go.indexOf("stage1.Start()")).isLessThan(go.indexOf("pipe0.Close()"));
        assertThat(go.indexOf("stage2.Start()")).isLessThan(go.indexOf("pipe1.Close()"));
        assertThat(go.indexOf("stage0.Wait()")).isLessThan(go.indexOf("stage2.Wait()"));
        assertThat(imports(go)).containsExactly("\"errors\"", "\"fmt\"", "\"os\"", "\"os/exec\"");
        assertThat(go).doesNotContain("func runCommand");
    }

    @Test
    void pipelineReleasesEachPipeOnceItsReaderRuns() throws Exception {
        String go = convert("yes | head -n 1");

        assertThat(go).contains("\t\tif err := stage1.Start(); err != nil {\n\t\t\treturn err\n\t\t}\n\t\tpipe0.Close()\n");
        assertThat(go.indexOf("pipe0.Close()")).isLessThan(go.indexOf("stage0.Wait()"));
        assertThat(go).doesNotContain("pipe1");
    }

    @Test
    void builtinsNeverSpawnProcesses() throws Exception {
        String go = convert(
                "cd /tmp",
                "pwd",
                "mkdir -p build/out",
                "rm -f stale.txt",
                "rm -rf build/tmp",
                "cp a.txt b.txt",
                "export MODE=fast",
                "test -n \"$MODE\"",
                "echo -n done",
                "true",
                "exit 0");

        assertThat(go).doesNotContain("runCommand").doesNotContain("commandSucceeds").doesNotContain("exec.");
        assertThat(go).contains(
                "if err := os.Chdir(\"/tmp\"); err != nil {",
                "if dir, err := os.Getwd(); err != nil {",
                "if err := os.MkdirAll(\"build/out\", 0755); err != nil {",
                "if err := os.Remove(\"stale.txt\"); err != nil && !os.IsNotExist(err) {",
                "if err := os.RemoveAll(\"build/tmp\"); err != nil && !os.IsNotExist(err) {",
                "if data, err := os.ReadFile(\"a.txt\"); err != nil {",
                "} else if err := os.WriteFile(\"b.txt\", data, 0644); err != nil {",
                "v_MODE = \"fast\"",
                "if err := os.Setenv(\"MODE\", v_MODE); err != nil {",
                "if !(v_MODE != \"\") {",
                "fmt.Print(\"done\")",
                "os.Exit(0)");
        assertThat(imports(go)).containsExactly("\"errors\"", "\"fmt\"", "\"os\"");
    }

    @Test
    void externalCommandsPropagateTheirStatus() throws Exception {
        String go = convert("go version");

        assertThat(go).contains("\tif err := runCommand(\"go\", \"version\"); err != nil {\n\t\treturn err\n\t}\n");
        assertThat(go).contains("func runCommand(name string, args ...string) error {");
        assertThat(imports(go)).containsExactly("\"errors\"", "\"fmt\"", "\"os\"", "\"os/exec\"");
    }

    @Test
    void generationIsDeterministic() throws Exception {
        String[] script = {
                "greet() { local who=$1; echo \"hi $who\"; }",
                "for i in {1..3}; do greet \"$i\"; done",
                "for f in a b c; do echo $f; done",
                "if [ \"$1\" = x ]; then echo x; elif [ $# -gt 2 ]; then echo many; else echo none; fi",
                "sleep 1 &",
                "(cd /tmp && ls | wc -l)",
                "echo log >> out.txt",
                "wait"
        };

        String first = convert(script);
        String second = convert(script);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void functionsBecomeGoFunctions() throws Exception {
        String go = convert(
                "greet() {",
                "  local who=$1",
                "  echo \"hi $who\"",
                "  return 2",
                "}",
                "greet bob");

        assertThat(go).contains("func fn_greet(args ...string) error {\n\tvar v_who string\n\t_ = v_who\n\tv_who = arg(args, 1)\n");
        assertThat(go).contains("\treturn exitStatus(2)\n");
        assertThat(go).contains("if err := fn_greet(\"bob\"); err != nil {");
        assertThat(go).contains("func arg(args []string, n int) string {");
        assertThat(go.indexOf("func fn_greet")).isLessThan(go.indexOf("func run("));
    }

    @Test
    void pwdPrintsTheDirectoryAndFailsLikeItsBody() throws Exception {
        String go = convert("pwd", "if pwd; then echo ok; fi");

        assertThat(go).contains("\tif dir, err := os.Getwd(); err != nil {\n\t\treturn err\n\t} else {\n\t\tfmt.Println(dir)\n\t}\n");
        assertThat(go).contains("if dir, err := os.Getwd(); err != nil {\n\t\t\treturn false\n");
    }

    @Test
    void subshellRestoresTheWorkingDirectory() throws Exception {
        String go = convert("(cd /tmp; pwd)", "pwd");

        assertThat(go).contains("if err := func() error {\n\t\tdefer enterSubshell()()\n\t\tif err := os.Chdir(\"/tmp\"); err != nil {");
        assertThat(go).contains("func enterSubshell() func() {");
    }

    @Test
    void subshellWritesStayInsideTheSubshell() throws Exception {
        String go = convert("X=outer", "(X=inner; cd /tmp)", "echo \"$X\"");

        assertThat(go).contains("if err := func() error {\n\t\tdefer enterSubshell()()\n\t\tv_X := v_X\n\t\t_ = v_X\n\t\tv_X = \"inner\"\n");
        assertThat(go).contains("\tv_X = \"outer\"\n");
        assertThat(go).contains("\tfmt.Println(v_X)\n");
    }

    @Test
    void subshellShadowsLoopVariablesAndReadTargets() throws Exception {
        String go = convert("(for f in a b; do echo \"$f\"; done; read line)");

        assertThat(go).contains("\t\tv_f := v_f\n\t\t_ = v_f\n\t\tv_line := v_line\n\t\t_ = v_line\n");
    }

    @Test
    void exitInsideASubshellLeavesOnlyTheSubshell() throws Exception {
        String go = convert("(exit 3)", "echo after");

        assertThat(go).contains("if err := func() error {\n\t\tdefer enterSubshell()()\n\t\treturn exitStatus(3)\n");
        assertThat(go).doesNotContain("os.Exit(3)");
    }

    @Test
    void exitWithAComputedStatusInsideASubshellParsesIt() throws Exception {
        String go = convert("CODE=4", "(exit \"$CODE\")");

        assertThat(go).contains("\t\treturn statusFrom(v_CODE)\n");
        assertThat(go).contains("func statusFrom(value string) error {");
        assertThat(imports(go)).contains("\"strconv\"", "\"strings\"");
    }

    @Test
    void exitOutsideASubshellStopsTheProcess() throws Exception {
        String go = convert("exit 3");

        assertThat(go).contains("\tos.Exit(3)\n");
    }

    @Test
    void backgroundJobsAreJoined() throws Exception {
        String go = convert("sleep 1 &", "wait");

        assertThat(go).contains("func run(args []string) (result error) {\n\tvar jobs jobGroup\n");
        assertThat(go).contains("\tjobs.Go(func() error {\n\t\tif err := runCommand(\"sleep\", \"1\"); err != nil {");
        assertThat(go).contains("if err := jobs.Wait(); err != nil {");
        assertThat(go).contains("type jobGroup struct {");
        assertThat(imports(go)).contains("\"sync\"");
    }

    @Test
    void redirectionSwapsTheStreamForOneStatement() throws Exception {
        String go = convert("echo hi > out.txt", "echo back");

        assertThat(go).contains(
                "file, err := os.OpenFile(\"out.txt\", os.O_WRONLY|os.O_CREATE|os.O_TRUNC, 0644)",
                "saved := os.Stdout",
                "os.Stdout = file",
                "defer func() { os.Stdout = saved }()");
        assertThat(go.indexOf("fmt.Println(\"hi\")")).isLessThan(go.indexOf("fmt.Println(\"back\")"));
    }

    @Test
    void loopsAndConditions() throws Exception {
        String go = convert(
                "for i in {1..3}; do echo $i; done",
                "while read -r line; do echo \"$line\"; done",
                "until [ -d out ]; do mkdir out; done",
                "if grep -q main go.mod; then echo yes; fi",
                "mkdir -p out && echo made");

        assertThat(go).contains("for i0 := 1; i0 <= 3; i0++ {\n\t\tv_i = strconv.Itoa(i0)\n");
        assertThat(go).contains("for readFields(&v_line) {");
        assertThat(go).contains("for !(isDir(\"out\")) {");
        assertThat(go).contains("if commandSucceeds(\"grep\", \"-q\", \"main\", \"go.mod\") {");
        assertThat(go).contains("\tif func() bool {\n\t\tif err := os.MkdirAll(\"out\", 0755); err != nil {\n\t\t\treturn false\n");
        assertThat(imports(go)).containsExactly(
                "\"bufio\"", "\"errors\"", "\"fmt\"", "\"os\"", "\"os/exec\"", "\"strconv\"", "\"strings\"");
    }

    @Test
    void positionalAndSpecialParameters() throws Exception {
        String go = convert("echo \"$0 $1 $# $@\"", "for a in \"$@\"; do echo $a; done");

        assertThat(go).contains("fmt.Println(os.Args[0] + \" \" + arg(args, 1) + \" \" + strconv.Itoa(len(args)) + \" \" + strings.Join(args, \" \"))");
        assertThat(go).contains("for _, v_a = range args {");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "source lib.sh|builtin 'source'",
            "echo a | read x|builtin 'read' in a pipeline",
            "f() { true; }; f | cat|function call 'f' in a pipeline",
            "f() { if return 1; then true; fi; }|return inside a condition",
            "cp -r a b|recursive cp",
            "read -p prompt x|read option '-p'",
            "(while exit 3; do true; done)|exit inside a condition of a subshell",
            "a-b() { true; }; a_b() { true; }|function names 'a-b' and 'a_b' map to the same Go identifier",
            "a.b() { true; }; a:b() { true; }|function names 'a.b' and 'a:b' map to the same Go identifier"
    })
    void constructsWithoutLoweringFailGeneration(String script, String kind) {
        assertThatThrownBy(() -> convert(script))
                .isInstanceOf(UnsupportedConstructException.class)
                .satisfies(e -> assertThat(((UnsupportedConstructException) e).kind()).isEqualTo(kind));
    }
}
