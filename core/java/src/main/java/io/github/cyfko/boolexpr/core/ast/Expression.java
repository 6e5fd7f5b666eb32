package io.github.cyfko.boolexpr.core.ast;

import java.util.Set;

/**
 * Node of a parsed boolean expression.
 * <p>
 * The hierarchy is closed: a node is either a bare {@link Word}, a single comparison
 * {@link Condition}, or a {@link BooleanNode} joining child nodes with {@code not}, {@code and}
 * or {@code or}. Consumers dispatch over the variants with an {@link ExpressionVisitor}, which
 * keeps every traversal exhaustive.
 * </p>
 *
 * <p>
 * Nodes are immutable records and are owned by the caller of the parse that produced them; no
 * node is shared between two parses.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface Expression permits Word, Condition, BooleanNode {

    /**
     * Canonical, whitespace-free rendering of the node, e.g. {@code and_(x>5, y<3)}.
     *
     * @return the canonical form
     */
    String repr();

    /**
     * Full names of every parameter referenced by this node and its descendants.
     * Recomputed on each call.
     *
     * @return the unique parameter names, in first-seen order
     */
    Set<String> params();

    <R> R accept(ExpressionVisitor<R> visitor);
}
