package org.shellgo.compiler;

import org.shellgo.compiler.api.CompilationException;
import org.shellgo.compiler.api.ICompiler;
import org.shellgo.compiler.api.MalformedSourceException;
import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.build.BuildDriver;
import org.shellgo.compiler.backend.build.BuildOptions;
import org.shellgo.compiler.backend.emit.GoCodeGenerator;
import org.shellgo.compiler.backend.emit.process.ProcessBackend;
import org.shellgo.compiler.backend.emit.process.ProcessBackends;
import org.shellgo.compiler.diagnostics.CompilerLogger;
import org.shellgo.compiler.diagnostics.Diagnostic;
import org.shellgo.compiler.diagnostics.DiagnosticsEngine;
import org.shellgo.compiler.frontend.irgen.IrConverterRegistry;
import org.shellgo.compiler.frontend.irgen.IrGenerator;
import org.shellgo.compiler.frontend.lexer.Lexer;
import org.shellgo.compiler.frontend.lexer.Token;
import org.shellgo.compiler.frontend.parser.Parser;
import org.shellgo.compiler.frontend.parser.ast.ScriptNode;
import org.shellgo.compiler.ir.IrProgram;

import java.nio.file.Path;
import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from
 * script text to Go source and, on request, to an executable. Each call uses
 * fresh diagnostics, so one instance can convert several scripts in turn.
 */
public class Compiler implements ICompiler {

    private final GoCodeGenerator generator;
    private final BuildDriver buildDriver;
    private final BuildOptions buildOptions;
    private int verbosity = -1;

    /**
     * Creates a compiler with the {@code os/exec} process backend and default build settings.
     */
    public Compiler() {
        this(ProcessBackends.defaultBackend(), new BuildDriver(), BuildOptions.defaults());
    }

    /**
     * @param processes The process backend of generated programs.
     * @param buildDriver The driver compiling generated source.
     * @param buildOptions The build settings.
     */
    public Compiler(ProcessBackend processes, BuildDriver buildDriver, BuildOptions buildOptions) {
        this.generator = new GoCodeGenerator(processes);
        this.buildDriver = buildDriver;
        this.buildOptions = buildOptions;
    }

    /**
     * Parses a script and builds its IR program.
     *
     * @param script The script text.
     * @param scriptName A name for the script, used in diagnostics.
     * @return The IR program.
     * @throws CompilationException if the script is malformed or uses a construct without a lowering rule.
     */
    public IrProgram buildIr(String script, String scriptName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String programName = programName(scriptName);

        // Phase 1: Lexical analysis
        Lexer lexer = new Lexer(script, diagnostics, programName);
        List<Token> tokens = lexer.scanTokens();
        CompilerLogger.debug("Compiler: " + tokens.size() + " tokens in " + programName);
        failOnErrors(diagnostics);

        // Phase 2: Parsing
        Parser parser = new Parser(tokens, diagnostics, programName);
        ScriptNode ast = parser.parse();
        failOnErrors(diagnostics);
        for (Diagnostic warning : diagnostics.getDiagnostics()) {
            CompilerLogger.warn(warning.toString());
        }

        // Phase 3: IR generation
        IrGenerator irGenerator = new IrGenerator(IrConverterRegistry.initializeWithDefaults());
        IrProgram program = irGenerator.generate(ast);
        CompilerLogger.debug("Compiler: " + program.statements().size() + " top-level statements, "
                + program.functions().size() + " functions, capabilities " + program.capabilities());
        return program;
    }

    /**
     * Generates Go source from an IR program.
     *
     * @param program The IR program.
     * @return The Go source.
     * @throws UnsupportedConstructException if a statement has no lowering rule.
     */
    public String generate(IrProgram program) throws UnsupportedConstructException {
        return generator.generate(program);
    }

    @Override
    public String convert(String script, String scriptName) throws CompilationException {
        IrProgram program = buildIr(script, scriptName);
        // Phase 4: Go code generation
        return generate(program);
    }

    @Override
    public void build(String script, String scriptName, Path outputPath) throws CompilationException {
        String source = convert(script, scriptName);
        // Phase 5: Go toolchain
        buildDriver.stageAndBuild(source, outputPath, buildOptions);
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    private static void failOnErrors(DiagnosticsEngine diagnostics) throws MalformedSourceException {
        if (diagnostics.hasErrors()) {
            throw new MalformedSourceException(diagnostics.summary());
        }
    }

    private static String programName(String scriptName) {
        Path fileName = Path.of(scriptName).getFileName();
        return fileName == null ? scriptName : fileName.toString();
    }
}
