package org.shellgo.compiler.backend.emit;

import java.util.Set;

/**
 * Go support code the generated program carries when it needs it. Helpers are
 * written in declaration order. The process helpers come from the configured
 * {@link org.shellgo.compiler.backend.emit.process.ProcessBackend}.
 */
public enum RuntimeHelper {
    /** Exit status of a script, carried as an error. */
    EXIT_STATUS(
            "type exitStatus int\n" +
            "\n" +
            "func (s exitStatus) Error() string {\n" +
            "\treturn fmt.Sprintf(\"exit status %d\", int(s))\n" +
            "}\n",
            Set.of("fmt")),
    /** Positional parameter lookup. */
    ARG(
            "func arg(args []string, n int) string {\n" +
            "\tif n < 1 || n > len(args) {\n" +
            "\t\treturn \"\"\n" +
            "\t}\n" +
            "\treturn args[n-1]\n" +
            "}\n",
            Set.of()),
    /** Lenient integer conversion for numeric tests and exit codes. */
    ATOI(
            "func atoi(value string) int {\n" +
            "\tn, err := strconv.Atoi(strings.TrimSpace(value))\n" +
            "\tif err != nil {\n" +
            "\t\treturn 0\n" +
            "\t}\n" +
            "\treturn n\n" +
            "}\n",
            Set.of("strconv", "strings")),
    /** Return status given as a non-literal value. */
    STATUS_FROM(
            "func statusFrom(value string) error {\n" +
            "\tcode, err := strconv.Atoi(strings.TrimSpace(value))\n" +
            "\tif err != nil {\n" +
            "\t\treturn fmt.Errorf(\"return: %s: numeric argument required\", value)\n" +
            "\t}\n" +
            "\tif code == 0 {\n" +
            "\t\treturn nil\n" +
            "\t}\n" +
            "\treturn exitStatus(code)\n" +
            "}\n",
            Set.of("fmt", "strconv", "strings")),
    /** Runs an external command and prints its combined output. */
    RUN_COMMAND(null, Set.of()),
    /** Runs an external command and reports whether it succeeded. */
    COMMAND_SUCCEEDS(null, Set.of()),
    /** File checks of test and [. */
    FILE_TESTS(
            "func isFile(path string) bool {\n" +
            "\tinfo, err := os.Stat(path)\n" +
            "\treturn err == nil && info.Mode().IsRegular()\n" +
            "}\n" +
            "\n" +
            "func isDir(path string) bool {\n" +
            "\tinfo, err := os.Stat(path)\n" +
            "\treturn err == nil && info.IsDir()\n" +
            "}\n" +
            "\n" +
            "func pathExists(path string) bool {\n" +
            "\t_, err := os.Stat(path)\n" +
            "\treturn err == nil\n" +
            "}\n",
            Set.of("os")),
    /** Line input for read. */
    READ_FIELDS(
            "var stdinReaders = map[*os.File]*bufio.Reader{}\n" +
            "\n" +
            "func readFields(targets ...*string) bool {\n" +
            "\treader, ok := stdinReaders[os.Stdin]\n" +
            "\tif !ok {\n" +
            "\t\treader = bufio.NewReader(os.Stdin)\n" +
            "\t\tstdinReaders[os.Stdin] = reader\n" +
            "\t}\n" +
            "\tline, err := reader.ReadString('\\n')\n" +
            "\tif err != nil && line == \"\" {\n" +
            "\t\treturn false\n" +
            "\t}\n" +
            "\tfields := strings.Fields(strings.TrimRight(line, \"\\r\\n\"))\n" +
            "\tfor i, target := range targets {\n" +
            "\t\tswitch {\n" +
            "\t\tcase i >= len(fields):\n" +
            "\t\t\t*target = \"\"\n" +
            "\t\tcase i == len(targets)-1:\n" +
            "\t\t\t*target = strings.Join(fields[i:], \" \")\n" +
            "\t\tdefault:\n" +
            "\t\t\t*target = fields[i]\n" +
            "\t\t}\n" +
            "\t}\n" +
            "\treturn true\n" +
            "}\n",
            Set.of("bufio", "os", "strings")),
    /** Working-directory isolation for subshells. */
    SUBSHELL(
            "func enterSubshell() func() {\n" +
            "\tdir, err := os.Getwd()\n" +
            "\treturn func() {\n" +
            "\t\tif err == nil {\n" +
            "\t\t\t_ = os.Chdir(dir)\n" +
            "\t\t}\n" +
            "\t}\n" +
            "}\n",
            Set.of("os")),
    /** Tracks background work and reports the first failure on join. */
    JOB_GROUP(
            "type jobGroup struct {\n" +
            "\twg    sync.WaitGroup\n" +
            "\tmu    sync.Mutex\n" +
            "\tfirst error\n" +
            "}\n" +
            "\n" +
            "func (g *jobGroup) Go(job func() error) {\n" +
            "\tg.wg.Add(1)\n" +
            "\tgo func() {\n" +
            "\t\tdefer g.wg.Done()\n" +
            "\t\tif err := job(); err != nil {\n" +
            "\t\t\tg.mu.Lock()\n" +
            "\t\t\tif g.first == nil {\n" +
            "\t\t\t\tg.first = err\n" +
            "\t\t\t}\n" +
            "\t\t\tg.mu.Unlock()\n" +
            "\t\t}\n" +
            "\t}()\n" +
            "}\n" +
            "\n" +
            "func (g *jobGroup) Wait() error {\n" +
            "\tg.wg.Wait()\n" +
            "\tg.mu.Lock()\n" +
            "\tdefer g.mu.Unlock()\n" +
            "\terr := g.first\n" +
            "\tg.first = nil\n" +
            "\treturn err\n" +
            "}\n",
            Set.of("sync"));

    private final String source;
    private final Set<String> imports;

    RuntimeHelper(String source, Set<String> imports) {
        this.source = source;
        this.imports = imports;
    }

    /**
     * @return The Go source of the helper, or {@code null} if the process backend supplies it.
     */
    public String source() {
        return source;
    }

    /**
     * @return The Go packages the helper source imports.
     */
    public Set<String> imports() {
        return imports;
    }

    /**
     * @return {@code true} if the process backend supplies the source.
     */
    public boolean isProcessHelper() {
        return source == null;
    }
}
