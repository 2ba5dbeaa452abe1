package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.builtins.BuiltinLoweringRegistry;
import org.shellgo.compiler.backend.emit.process.ProcessBackend;
import org.shellgo.compiler.ir.IrProgram;
import org.shellgo.compiler.ir.IrStatement;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * State shared by lowering rules while one program is lowered.
 * <p>
 * The generator lowers a program twice. The collecting context records every
 * import, helper and job scope a rule asks for; the emitting context only accepts
 * what the collecting pass recorded, so the two passes cannot drift apart.
 */
public final class EmitContext {

    /** Packages every generated program imports. */
    public static final Set<String> BASE_IMPORTS = Set.of("errors", "fmt", "os");

    /** Scope name of the entry point. */
    public static final String ENTRY_SCOPE = "";

    /**
     * Closures a statement can be lowered into. Outside of any closure statements
     * belong to a function body.
     */
    public enum Frame {
        /** {@code func() error} isolating a subshell. */
        SUBSHELL,
        /** {@code func() error} holding a redirected statement. */
        REDIRECTION,
        /** {@code func() error} run as a background job. */
        JOB,
        /** {@code func() bool} evaluating a condition. */
        CONDITION
    }

    private final LoweringRegistry rules;
    private final BuiltinLoweringRegistry builtins;
    private final ProcessBackend processes;
    private final GoDependencies collected;
    private final Set<String> programVariables;

    private final SortedSet<String> imports = new TreeSet<>(BASE_IMPORTS);
    private final Set<RuntimeHelper> helpers = EnumSet.of(RuntimeHelper.EXIT_STATUS);
    private final Set<String> jobScopes = new TreeSet<>();
    private final Deque<Frame> frames = new ArrayDeque<>();

    private String scope = ENTRY_SCOPE;
    private Set<String> locals = Set.of();
    private int counter;

    private EmitContext(IrProgram program, LoweringRegistry rules, BuiltinLoweringRegistry builtins,
                        ProcessBackend processes, GoDependencies collected) {
        this.rules = rules;
        this.builtins = builtins;
        this.processes = processes;
        this.collected = collected;
        this.programVariables = program.variables().keySet();
    }

    /**
     * @return A context for the collection pass.
     */
    public static EmitContext collecting(IrProgram program, LoweringRegistry rules,
                                         BuiltinLoweringRegistry builtins, ProcessBackend processes) {
        return new EmitContext(program, rules, builtins, processes, null);
    }

    /**
     * @param collected The result of the collection pass.
     * @return A context for the emission pass.
     */
    public static EmitContext emitting(IrProgram program, LoweringRegistry rules, BuiltinLoweringRegistry builtins,
                                       ProcessBackend processes, GoDependencies collected) {
        return new EmitContext(program, rules, builtins, processes, collected);
    }

    /**
     * @return What this context recorded.
     */
    public GoDependencies dependencies() {
        return new GoDependencies(imports, helpers, jobScopes);
    }

    // --- scopes and frames ---

    /**
     * Starts lowering the body of a function or of the entry point.
     * @param name The function name, or {@link #ENTRY_SCOPE}.
     * @param localNames Variables local to the function.
     */
    public void enterScope(String name, Set<String> localNames) {
        scope = name;
        locals = Set.copyOf(localNames);
        frames.clear();
    }

    /**
     * @return The name of the function being lowered.
     */
    public String scope() {
        return scope;
    }

    public void pushFrame(Frame frame) {
        frames.push(frame);
    }

    public void popFrame() {
        frames.pop();
    }

    /**
     * @return {@code true} if the innermost closure is a condition.
     */
    public boolean inCondition() {
        return frames.peek() == Frame.CONDITION;
    }

    /**
     * @return {@code true} if any enclosing closure is a subshell.
     */
    public boolean inSubshell() {
        return frames.contains(Frame.SUBSHELL);
    }

    /**
     * @return {@code true} if a {@code return} statement would leave the function or the subshell.
     */
    public boolean canReturn() {
        return frames.isEmpty() || frames.peek() == Frame.SUBSHELL;
    }

    /**
     * @return The statement handling a failure held in {@code err}.
     */
    public String onError() {
        return inCondition() ? "return false" : "return err";
    }

    /**
     * @param error A Go expression of type {@code error}.
     * @return The statement failing with that error.
     */
    public String fail(String error) {
        return inCondition() ? "return false" : "return " + error;
    }

    /**
     * Writes a call whose error result stops the current body.
     * @param out The target.
     * @param call A Go expression of type {@code error}.
     */
    public void propagate(CodeBuilder out, String call) {
        propagate(out, GoExpr.of(call));
    }

    public void propagate(CodeBuilder out, GoExpr call) {
        out.openExpression("if err := ", call, "; err != nil {");
        out.line(onError());
        out.close("}");
    }

    // --- dependencies ---

    /**
     * Declares the use of a runtime helper and the packages its source imports.
     * @param helper The helper.
     * @throws IllegalStateException in the emission pass, if the collection pass did not see the use.
     */
    public void use(RuntimeHelper helper) {
        if (collected != null) {
            if (!collected.helpers().contains(helper)) {
                throw new IllegalStateException("Helper " + helper + " was not collected");
            }
            return;
        }
        helpers.add(helper);
        imports.addAll(helper.isProcessHelper() ? processes.helperImports(helper) : helper.imports());
    }

    /**
     * Declares the use of a Go package by generated code.
     * @param path The import path.
     * @throws IllegalStateException in the emission pass, if the collection pass did not see the use.
     */
    public void importPackage(String path) {
        if (collected != null) {
            if (!collected.imports().contains(path)) {
                throw new IllegalStateException("Import " + path + " was not collected");
            }
            return;
        }
        imports.add(path);
    }

    /**
     * Declares that the current function starts background jobs or joins them.
     */
    public void useJobs() {
        use(RuntimeHelper.JOB_GROUP);
        if (collected != null) {
            if (!collected.jobScopes().contains(scope)) {
                throw new IllegalStateException("Job scope '" + scope + "' was not collected");
            }
            return;
        }
        jobScopes.add(scope);
    }

    /**
     * @param name A scope name.
     * @return {@code true} if the collection pass found background work in that scope.
     */
    public boolean hasJobs(String name) {
        return collected != null && collected.jobScopes().contains(name);
    }

    // --- values ---

    /**
     * @param irValue An IR value.
     * @return The Go string expression computing it.
     */
    public String value(String irValue) {
        return VariableSplicer.splice(irValue, this);
    }

    /**
     * @param irValues IR values.
     * @return One Go expression per value.
     */
    public List<String> values(List<String> irValues) {
        return irValues.stream().map(this::value).toList();
    }

    /**
     * Resolves a variable or parameter reference.
     * @param name The referenced name.
     * @return The Go expression reading it.
     */
    public String resolve(String name) {
        switch (name) {
            case "@", "*" -> {
                importPackage("strings");
                return "strings.Join(args, \" \")";
            }
            case "#" -> {
                importPackage("strconv");
                return "strconv.Itoa(len(args))";
            }
            case "0" -> {
                return "os.Args[0]";
            }
            default -> {
                if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
                    use(RuntimeHelper.ARG);
                    return "arg(args, " + Integer.parseInt(name) + ")";
                }
                if (isVariable(name)) {
                    return GoSyntax.variable(name);
                }
                return "os.Getenv(" + GoSyntax.quote(name) + ")";
            }
        }
    }

    /**
     * @param name A variable name.
     * @return {@code true} if the name is a local of the current function or a program variable.
     */
    public boolean isVariable(String name) {
        return locals.contains(name) || programVariables.contains(name);
    }

    /**
     * @param name A variable that is assigned.
     * @return The Go variable receiving the value.
     * @throws IllegalStateException if the program never declares the variable.
     */
    public String target(String name) {
        if (!isVariable(name)) {
            throw new IllegalStateException("Variable '" + name + "' is not declared");
        }
        return GoSyntax.variable(name);
    }

    /**
     * @param prefix The name stem.
     * @return A Go identifier not handed out before in this program.
     */
    public String uniqueName(String prefix) {
        return prefix + counter++;
    }

    // --- lowering ---

    /**
     * Lowers one statement through its rule.
     * @param statement The statement.
     * @param out The target.
     * @throws UnsupportedConstructException if the statement has no lowering rule.
     */
    public void lower(IrStatement statement, CodeBuilder out) throws UnsupportedConstructException {
        rules.resolve(statement).lower(statement, out, this);
    }

    public void lowerAll(List<IrStatement> statements, CodeBuilder out) throws UnsupportedConstructException {
        for (IrStatement statement : statements) {
            lower(statement, out);
        }
    }

    /**
     * Lowers statements into the body of a closure.
     * @param frame The closure kind.
     * @param statements The statements.
     * @param last The final statement of the body, e.g. {@code return nil}.
     * @return The body lines, indented one level.
     * @throws UnsupportedConstructException if a statement has no lowering rule.
     */
    public List<String> closureBody(Frame frame, List<IrStatement> statements, String last) throws UnsupportedConstructException {
        CodeBuilder body = new CodeBuilder(1);
        pushFrame(frame);
        try {
            lowerAll(statements, body);
        } finally {
            popFrame();
        }
        return body.line(last).lines();
    }

    /**
     * @param condition Condition statements; the status of the last one decides.
     * @return A Go boolean expression.
     * @throws UnsupportedConstructException if a statement has no lowering rule.
     */
    public GoExpr condition(List<IrStatement> condition) throws UnsupportedConstructException {
        return ConditionLowering.lower(condition, this);
    }

    public BuiltinLoweringRegistry builtins() {
        return builtins;
    }

    public ProcessBackend processes() {
        return processes;
    }
}
