package io.github.cyfko.boolexpr.core.parsing;

import io.github.cyfko.boolexpr.core.ast.BooleanNode;
import io.github.cyfko.boolexpr.core.ast.Expression;
import io.github.cyfko.boolexpr.core.ast.LogicOp;

import java.util.List;

/**
 * Builds the composite node for a run of operands joined by the same boolean operator.
 * <p>
 * {@code operands} holds exactly one element for {@link LogicOp#NOT} and at least two for
 * {@link LogicOp#AND} and {@link LogicOp#OR}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CombinatorFactory {

    CombinatorFactory DEFAULT = BooleanNode::new;

    Expression combine(LogicOp op, List<Expression> operands);
}
