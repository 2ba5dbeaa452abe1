package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.builtins.BuiltinLoweringRegistry;
import org.shellgo.compiler.backend.emit.process.ProcessBackend;
import org.shellgo.compiler.backend.emit.process.ProcessBackends;
import org.shellgo.compiler.diagnostics.CompilerLogger;
import org.shellgo.compiler.ir.IrFunction;
import org.shellgo.compiler.ir.IrProgram;
import org.shellgo.compiler.ir.IrStatement;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Generates a Go program from an IR program.
 * <p>
 * Generation runs in two passes over the same lowering rules. The first pass
 * collects imports, runtime helpers and the functions that run background jobs;
 * the second writes the source in a fixed order: package clause, sorted imports,
 * sorted package variables, helpers, script functions in table order, the entry
 * point and {@code main}. The output depends only on the program, so generating
 * twice yields identical text.
 */
public final class GoCodeGenerator {

    private final LoweringRegistry rules;
    private final BuiltinLoweringRegistry builtins;
    private final ProcessBackend processes;

    /**
     * Creates a generator with explicit rule tables and process backend.
     *
     * @param rules The statement lowering rules.
     * @param builtins The builtin lowerings.
     * @param processes The process execution backend.
     */
    public GoCodeGenerator(LoweringRegistry rules, BuiltinLoweringRegistry builtins, ProcessBackend processes) {
        this.rules = rules;
        this.builtins = builtins;
        this.processes = processes;
    }

    /**
     * @param processes The process execution backend.
     */
    public GoCodeGenerator(ProcessBackend processes) {
        this(LoweringRegistry.initializeWithDefaults(), BuiltinLoweringRegistry.initializeWithDefaults(), processes);
    }

    /**
     * Creates a generator with the default rules and the {@code os/exec} backend.
     */
    public GoCodeGenerator() {
        this(ProcessBackends.defaultBackend());
    }

    /**
     * Generates the Go source of a program.
     *
     * @param program The IR program.
     * @return The complete Go source file.
     * @throws UnsupportedConstructException if a statement has no lowering rule; nothing is returned then.
     */
    public String generate(IrProgram program) throws UnsupportedConstructException {
        checkFunctionNames(program);
        EmitContext collector = EmitContext.collecting(program, rules, builtins, processes);
        writeDeclarations(program, collector);
        GoDependencies dependencies = collector.dependencies();
        CompilerLogger.debug("GoCodeGenerator: " + program.programName() + " needs imports " + dependencies.imports()
                + " and helpers " + dependencies.helpers());

        EmitContext emitter = EmitContext.emitting(program, rules, builtins, processes, dependencies);
        CodeBuilder declarations = writeDeclarations(program, emitter);

        CodeBuilder out = new CodeBuilder();
        out.line("// Code generated by shellgo from " + program.programName() + ". DO NOT EDIT.");
        out.blank();
        out.line("package main");
        out.blank();
        out.open("import (");
        for (String path : dependencies.imports()) {
            out.line(GoSyntax.quote(path));
        }
        out.close(")");

        Set<String> variables = new TreeSet<>(program.variables().keySet());
        if (!variables.isEmpty()) {
            out.blank();
            for (String name : variables) {
                out.line("var " + GoSyntax.variable(name) + " = os.Getenv(" + GoSyntax.quote(name) + ")");
            }
        }

        for (RuntimeHelper helper : dependencies.helpers()) {
            String source = helper.isProcessHelper() ? processes.helperSource(helper) : helper.source();
            out.blank();
            for (String line : source.split("\n")) {
                out.line(line);
            }
        }

        for (String line : declarations.lines()) {
            out.line(line);
        }
        String source = out.toString();
        CompilerLogger.debug("GoCodeGenerator: generated " + source.length() + " characters for " + program.programName());
        return source;
    }

    private static void checkFunctionNames(IrProgram program) throws UnsupportedConstructException {
        Map<String, String> owners = new HashMap<>();
        for (IrFunction function : program.functions().values()) {
            String previous = owners.putIfAbsent(GoSyntax.function(function.name()), function.name());
            if (previous != null) {
                throw new UnsupportedConstructException("function names '" + previous + "' and '" + function.name()
                        + "' map to the same Go identifier", function.source());
            }
        }
    }

    private CodeBuilder writeDeclarations(IrProgram program, EmitContext ctx) throws UnsupportedConstructException {
        CodeBuilder out = new CodeBuilder();
        for (IrFunction function : program.functions().values()) {
            ctx.enterScope(function.name(), function.locals().keySet());
            out.blank();
            String result = ctx.hasJobs(function.name()) ? "(result error)" : "error";
            out.open("func " + GoSyntax.function(function.name()) + "(args ...string) " + result + " {");
            writeLocals(function, out);
            writeBody(function.body(), out, ctx);
            out.close("}");
        }

        ctx.enterScope(EmitContext.ENTRY_SCOPE, Set.of());
        out.blank();
        String result = ctx.hasJobs(EmitContext.ENTRY_SCOPE) ? "(result error)" : "error";
        out.open("func run(args []string) " + result + " {");
        writeBody(program.statements(), out, ctx);
        out.close("}");

        out.blank();
        out.open("func main() {");
        out.open("if err := run(os.Args[1:]); err != nil {");
        out.line("var status exitStatus");
        out.open("if errors.As(err, &status) {");
        out.line("os.Exit(int(status))");
        out.close("}");
        out.line("fmt.Fprintf(os.Stderr, \"Error: %v\\n\", err)");
        out.line("os.Exit(1)");
        out.close("}");
        out.close("}");
        return out;
    }

    private static void writeLocals(IrFunction function, CodeBuilder out) {
        for (String name : new TreeSet<>(function.locals().keySet())) {
            String variable = GoSyntax.variable(name);
            out.line("var " + variable + " string");
            out.line("_ = " + variable);
        }
    }

    private static void writeBody(List<IrStatement> body, CodeBuilder out, EmitContext ctx)
            throws UnsupportedConstructException {
        if (ctx.hasJobs(ctx.scope())) {
            out.line("var jobs jobGroup");
            out.open("defer func() {");
            out.open("if waitErr := jobs.Wait(); result == nil {");
            out.line("result = waitErr");
            out.close("}");
            out.close("}()");
        }
        ctx.lowerAll(body, out);
        out.line("return nil");
    }
}
