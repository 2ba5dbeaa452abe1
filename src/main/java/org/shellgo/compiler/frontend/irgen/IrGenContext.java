package org.shellgo.compiler.frontend.irgen;

import org.shellgo.compiler.api.SourceInfo;
import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.frontend.parser.ast.AstNode;
import org.shellgo.compiler.frontend.parser.ast.WordNode;
import org.shellgo.compiler.ir.Capability;
import org.shellgo.compiler.ir.CommandClass;
import org.shellgo.compiler.ir.IrFunction;
import org.shellgo.compiler.ir.IrProgram;
import org.shellgo.compiler.ir.IrStatement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable context passed to converters during IR generation.
 * <p>
 * Holds a stack of output buffers (nested statement lists are converted into a
 * fresh buffer), the function and variable tables, the accumulated capabilities
 * and the scope of the function currently being converted.
 */
public final class IrGenContext {

    private final String programName;
    private final IrConverterRegistry registry;
    private final WordValueExtractor words = new WordValueExtractor(this);
    private final Deque<List<IrStatement>> buffers = new ArrayDeque<>();
    private final Map<String, IrFunction> functions = new LinkedHashMap<>();
    private final Set<String> declaredFunctions = new HashSet<>();
    private final Set<String> scriptFunctions = new HashSet<>();
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
    private FunctionScope functionScope;

    /**
     * Scope of a function body while it is converted.
     */
    public static final class FunctionScope {
        private final String name;
        private final Map<String, String> locals = new LinkedHashMap<>();
        private int highestPositional = 0;

        FunctionScope(String name) {
            this.name = name;
        }

        /** @return The function name. */
        public String name() {
            return name;
        }

        /** @return Local variable name to last literal value. */
        public Map<String, String> locals() {
            return locals;
        }

        /** @return Parameter names {@code "1".."n"} for the highest positional parameter used. */
        public List<String> parameters() {
            List<String> params = new ArrayList<>();
            for (int i = 1; i <= highestPositional; i++) {
                params.add(String.valueOf(i));
            }
            return params;
        }
    }

    /**
     * Constructs a new IR generation context.
     * @param programName The name of the script being converted.
     * @param registry The registry for resolving node converters.
     */
    public IrGenContext(String programName, IrConverterRegistry registry) {
        this.programName = programName;
        this.registry = registry;
        buffers.push(new ArrayList<>());
    }

    /**
     * Emits a statement into the current buffer.
     * @param statement The statement to add.
     */
    public void emit(IrStatement statement) {
        buffers.peek().add(statement);
    }

    /**
     * Converts the given node by resolving and invoking the appropriate converter.
     * @param node The node to convert.
     * @throws UnsupportedConstructException if the node cannot be lowered.
     */
    public void convert(AstNode node) throws UnsupportedConstructException {
        registry.resolve(node).convert(node, this);
    }

    /**
     * Converts nodes into a separate buffer and returns what they emitted.
     * @param nodes The nodes to convert, in order.
     * @return The emitted statements.
     * @throws UnsupportedConstructException if a node cannot be lowered.
     */
    public List<IrStatement> collect(List<? extends AstNode> nodes) throws UnsupportedConstructException {
        buffers.push(new ArrayList<>());
        try {
            for (AstNode node : nodes) {
                convert(node);
            }
            return buffers.peek();
        } finally {
            buffers.pop();
        }
    }

    /**
     * Converts a single node into a separate buffer.
     * @param node The node to convert.
     * @return The emitted statements.
     * @throws UnsupportedConstructException if the node cannot be lowered.
     */
    public List<IrStatement> collect(AstNode node) throws UnsupportedConstructException {
        return collect(List.of(node));
    }

    /**
     * Extracts the IR value of a word.
     * @param word The word.
     * @return The IR value.
     * @throws UnsupportedConstructException if the word uses an expansion without a lowering rule.
     */
    public String value(WordNode word) throws UnsupportedConstructException {
        return words.extract(word);
    }

    /**
     * Extracts the IR values of several words.
     * @param list The words.
     * @return The IR values in order.
     * @throws UnsupportedConstructException if a word cannot be lowered.
     */
    public List<String> values(List<WordNode> list) throws UnsupportedConstructException {
        List<String> out = new ArrayList<>(list.size());
        for (WordNode word : list) {
            out.add(value(word));
        }
        return out;
    }

    /**
     * Classifies a literal command name.
     * @param name The command name, or {@code null} if it is not a literal.
     * @return The classification.
     */
    public CommandClass classify(String name) {
        if (name == null) return CommandClass.EXTERNAL;
        if (declaredFunctions.contains(name)) return CommandClass.FUNCTION;
        if (functionScope != null && scriptFunctions.contains(name)) return CommandClass.FUNCTION;
        if (BuiltinTable.isBuiltin(name)) return CommandClass.BUILTIN;
        return CommandClass.EXTERNAL;
    }

    /**
     * Adds a capability to the program's requirements.
     * @param capability The capability.
     */
    public void require(Capability capability) {
        capabilities.add(capability);
    }

    /**
     * Records the last literal value of a variable in the function scope or the program table.
     * @param name The variable name.
     * @param value The assigned IR value.
     * @param local Whether the assignment declares a function-local variable.
     */
    public void recordVariable(String name, String value, boolean local) {
        if (functionScope != null && (local || functionScope.locals.containsKey(name))) {
            functionScope.locals.put(name, value);
        } else {
            variables.put(name, value);
        }
    }

    /**
     * Makes a variable known without changing a value recorded earlier.
     * @param name The variable name.
     */
    public void declareVariable(String name) {
        if (!isLocal(name) && !variables.containsKey(name)) {
            variables.put(name, "");
        }
    }

    /**
     * @param name A variable name.
     * @return {@code true} if the name is local to the function being converted.
     */
    public boolean isLocal(String name) {
        return functionScope != null && functionScope.locals.containsKey(name);
    }

    /**
     * Notes that a positional parameter is used.
     * @param index The parameter number.
     */
    public void usePositional(int index) {
        if (functionScope != null && index > functionScope.highestPositional) {
            functionScope.highestPositional = index;
        }
    }

    /**
     * Makes a function name known, so later calls classify as {@link CommandClass#FUNCTION}.
     * @param name The function name.
     */
    public void declareFunction(String name) {
        declaredFunctions.add(name);
    }

    /**
     * Makes a function defined anywhere in the script callable from function bodies.
     * Bodies only run once the whole script has been read, so they may call
     * functions defined further down; top-level calls still need the definition first.
     * @param name The function name.
     */
    public void announceFunction(String name) {
        scriptFunctions.add(name);
    }

    /**
     * Opens the scope of a function body.
     * @param name The function name.
     * @param source Where the function is defined.
     * @throws UnsupportedConstructException if a function is defined inside another function,
     *         or if a function of that name was defined before.
     */
    public void enterFunction(String name, SourceInfo source) throws UnsupportedConstructException {
        if (functionScope != null) {
            throw new UnsupportedConstructException("nested function definition '" + name + "'", source);
        }
        if (functions.containsKey(name)) {
            throw new UnsupportedConstructException("redefinition of function '" + name + "'", source);
        }
        functionScope = new FunctionScope(name);
    }

    /**
     * Closes the scope opened by {@link #enterFunction}.
     * @return The closed scope.
     */
    public FunctionScope exitFunction() {
        FunctionScope scope = functionScope;
        functionScope = null;
        return scope;
    }

    /**
     * @return {@code true} while a function body is converted.
     */
    public boolean inFunction() {
        return functionScope != null;
    }

    /**
     * Adds a function to the table.
     * @param function The function.
     */
    public void defineFunction(IrFunction function) {
        functions.put(function.name(), function);
    }

    /**
     * @param node A node.
     * @return Its script position.
     */
    public SourceInfo sourceOf(AstNode node) {
        return node.source();
    }

    /**
     * Builds the final {@link IrProgram} from the emitted statements.
     * @return The constructed program.
     */
    public IrProgram build() {
        return new IrProgram(programName, buffers.getLast(), functions, variables, capabilities);
    }
}
