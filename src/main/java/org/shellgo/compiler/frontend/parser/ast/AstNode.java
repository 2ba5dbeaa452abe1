package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the shell syntax tree.
 * <p>
 * The tree is read-only: the IR builder walks it but never rewrites it.
 */
public interface AstNode {

    /**
     * Returns a list of the direct child nodes.
     * This allows generic traversal without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * @return Where the node starts in the script, or {@link SourceInfo#UNKNOWN}.
     */
    default SourceInfo source() {
        return SourceInfo.UNKNOWN;
    }
}
