package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.ast.BooleanNode;
import io.github.cyfko.boolexpr.core.ast.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of one {@link DslParser#parse(String)} call.
 *
 * @param input the parsed text
 * @param root  the AST root: a single clause or a {@link BooleanNode}
 * @since 1.0.0
 */
public record ParsedExpression(String input, Expression root) {

    public ParsedExpression {
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(root, "root cannot be null");
    }

    /** @return the full names of every referenced parameter */
    public Set<String> params() {
        return root.params();
    }

    /**
     * @return the root itself when it is a single clause, otherwise the root's direct children
     */
    public List<Expression> conditions() {
        if (root instanceof BooleanNode node) {
            return node.conditions();
        }
        return List.of(root);
    }

    public boolean isSingleClause() {
        return !(root instanceof BooleanNode);
    }

    public String repr() {
        return root.repr();
    }

    @Override
    public String toString() {
        return repr();
    }
}
