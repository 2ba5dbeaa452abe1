package org.shellgo.compiler.frontend.parser.ast;

import org.shellgo.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code case WORD in ... esac} statement.
 *
 * @param subject The word being matched.
 * @param items The pattern clauses in source order.
 * @param source The position of the keyword.
 */
public record CaseNode(WordNode subject, List<Item> items, SourceInfo source) implements AstNode {

    public CaseNode {
        items = List.copyOf(items);
    }

    /**
     * One {@code pattern) body ;;} clause.
     *
     * @param patterns The alternative patterns.
     * @param body The clause body.
     */
    public record Item(List<WordNode> patterns, List<StatementNode> body) {
        public Item {
            patterns = List.copyOf(patterns);
            body = List.copyOf(body);
        }
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(subject);
        for (Item item : items) {
            children.addAll(item.patterns());
            children.addAll(item.body());
        }
        return children;
    }
}
