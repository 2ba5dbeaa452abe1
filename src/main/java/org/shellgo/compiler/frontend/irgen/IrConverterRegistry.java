package org.shellgo.compiler.frontend.irgen;

import org.shellgo.compiler.frontend.irgen.converters.BinaryNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.BlockNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.CallNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.DeclNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.ForNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.FunctionNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.IfNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.StatementNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.SubshellNodeConverter;
import org.shellgo.compiler.frontend.irgen.converters.WhileNodeConverter;
import org.shellgo.compiler.frontend.parser.ast.AstNode;
import org.shellgo.compiler.frontend.parser.ast.BinaryNode;
import org.shellgo.compiler.frontend.parser.ast.BlockNode;
import org.shellgo.compiler.frontend.parser.ast.CallNode;
import org.shellgo.compiler.frontend.parser.ast.DeclNode;
import org.shellgo.compiler.frontend.parser.ast.ForNode;
import org.shellgo.compiler.frontend.parser.ast.FunctionNode;
import org.shellgo.compiler.frontend.parser.ast.IfNode;
import org.shellgo.compiler.frontend.parser.ast.StatementNode;
import org.shellgo.compiler.frontend.parser.ast.SubshellNode;
import org.shellgo.compiler.frontend.parser.ast.WhileNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping syntax node classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback. The {@link #resolve(AstNode)} method
 * walks the class hierarchy to find the nearest registered converter; nodes without one reach the
 * default converter, which rejects them.
 */
public final class IrConverterRegistry {

    private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();
    private final IAstNodeToIrConverter<AstNode> defaultConverter;

    private IrConverterRegistry(IAstNodeToIrConverter<AstNode> defaultConverter) {
        this.defaultConverter = defaultConverter;
    }

    /**
     * Registers a converter for the given node class.
     *
     * @param nodeType  The concrete node class.
     * @param converter The converter instance handling that class.
     * @param <T>       Concrete node type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
        byClass.put(nodeType, converter);
    }

    /**
     * Resolves a converter for the given node by searching the node's concrete class,
     * then walking up its superclasses and interfaces. Falls back to the default converter.
     *
     * @param node The node instance to resolve a converter for.
     * @return A non-null converter to handle the node.
     */
    @SuppressWarnings("unchecked")
    public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
        Class<?> c = node.getClass();
        while (c != null && AstNode.class.isAssignableFrom(c)) {
            IAstNodeToIrConverter<?> found = byClass.get(c);
            if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
            for (Class<?> i : c.getInterfaces()) {
                if (AstNode.class.isAssignableFrom(i)) {
                    found = byClass.get(i.asSubclass(AstNode.class));
                    if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
                }
            }
            c = c.getSuperclass();
        }
        return defaultConverter;
    }

    /**
     * Creates a registry with the given default converter and no specific converters.
     *
     * @param defaultConverter The fallback converter used for unknown node types.
     * @return A new registry instance.
     */
    public static IrConverterRegistry initialize(IAstNodeToIrConverter<AstNode> defaultConverter) {
        return new IrConverterRegistry(defaultConverter);
    }

    /**
     * Initializes a registry with the rejecting default converter and all built-in converters.
     *
     * @return A registry pre-populated with the standard converters.
     */
    public static IrConverterRegistry initializeWithDefaults() {
        IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
        reg.register(StatementNode.class, new StatementNodeConverter());
        reg.register(CallNode.class, new CallNodeConverter());
        reg.register(DeclNode.class, new DeclNodeConverter());
        reg.register(BinaryNode.class, new BinaryNodeConverter());
        reg.register(IfNode.class, new IfNodeConverter());
        reg.register(WhileNode.class, new WhileNodeConverter());
        reg.register(ForNode.class, new ForNodeConverter());
        reg.register(SubshellNode.class, new SubshellNodeConverter());
        reg.register(BlockNode.class, new BlockNodeConverter());
        reg.register(FunctionNode.class, new FunctionNodeConverter());
        return reg;
    }
}
