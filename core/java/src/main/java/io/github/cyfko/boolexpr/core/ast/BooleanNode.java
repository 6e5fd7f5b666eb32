package io.github.cyfko.boolexpr.core.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Composite node joining child expressions with one boolean operator.
 * <p>
 * Same-precedence chains are flattened when parsing, so {@code a and b and c} yields a single
 * {@code AND} node with three children. A {@code NOT} node has exactly one child; {@code AND} and
 * {@code OR} nodes have at least two.
 * </p>
 *
 * @param op       the boolean operator
 * @param children the operands, in source order
 * @since 1.0.0
 */
public record BooleanNode(LogicOp op, List<Expression> children) implements Expression {

    public BooleanNode {
        Objects.requireNonNull(op, "op cannot be null");
        Objects.requireNonNull(children, "children cannot be null");
        children = List.copyOf(children);
        if (op.isUnary() && children.size() != 1) {
            throw new IllegalArgumentException("not expects exactly one operand, got " + children.size());
        }
        if (!op.isUnary() && children.size() < 2) {
            throw new IllegalArgumentException(op.keyword() + " expects at least two operands, got " + children.size());
        }
    }

    public static BooleanNode not(Expression operand) {
        return new BooleanNode(LogicOp.NOT, List.of(operand));
    }

    public static BooleanNode and(Expression... operands) {
        return new BooleanNode(LogicOp.AND, List.of(operands));
    }

    public static BooleanNode or(Expression... operands) {
        return new BooleanNode(LogicOp.OR, List.of(operands));
    }

    /** @return the direct children of this node */
    public List<Expression> conditions() {
        return children;
    }

    @Override
    public String repr() {
        return children.stream()
                .map(Expression::repr)
                .collect(Collectors.joining(", ", op.keyword() + "_(", ")"));
    }

    @Override
    public Set<String> params() {
        Set<String> params = new LinkedHashSet<>();
        for (Expression child : children) {
            params.addAll(child.params());
        }
        return params;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public String toString() {
        return repr();
    }
}
