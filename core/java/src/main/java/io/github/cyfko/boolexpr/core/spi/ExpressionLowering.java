package io.github.cyfko.boolexpr.core.spi;

import io.github.cyfko.boolexpr.core.ast.BooleanNode;
import io.github.cyfko.boolexpr.core.ast.Condition;
import io.github.cyfko.boolexpr.core.ast.Expression;
import io.github.cyfko.boolexpr.core.ast.ExpressionVisitor;
import io.github.cyfko.boolexpr.core.ast.LogicOp;
import io.github.cyfko.boolexpr.core.ast.Word;

import java.util.ArrayList;
import java.util.List;

/**
 * Backend capability translating the AST into the backend's own predicate type.
 * <p>
 * Implementations provide the leaf translations and the boolean connectives;
 * {@link #lower(Expression, Object)} walks the tree, lowering every child before combining it.
 * Any failure aborts the whole walk: no partial predicate is ever returned.
 * </p>
 *
 * <pre>{@code
 * Predicate predicate = lowering.lower(BoolExpr.parse("x > 5 and not y == 2").root(), scope);
 * }</pre>
 *
 * @param <P> backend predicate type
 * @param <S> scope the predicate is built in (query, builder, candidate sources...)
 * @since 1.0.0
 */
public interface ExpressionLowering<P, S> {

    P lowerCondition(Condition condition, S scope);

    P lowerWord(Word word, S scope);

    /**
     * Applies a connective to already lowered operands.
     *
     * @param op       the connective
     * @param operands one operand for {@link LogicOp#NOT}, at least two otherwise
     * @param scope    the building scope
     * @return the combined predicate
     */
    P combine(LogicOp op, List<P> operands, S scope);

    default P lower(Expression expression, S scope) {
        return expression.accept(new ExpressionVisitor<P>() {
            @Override
            public P visitWord(Word word) {
                return lowerWord(word, scope);
            }

            @Override
            public P visitCondition(Condition condition) {
                return lowerCondition(condition, scope);
            }

            @Override
            public P visitBoolean(BooleanNode node) {
                List<P> operands = new ArrayList<>(node.children().size());
                for (Expression child : node.children()) {
                    operands.add(child.accept(this));
                }
                return combine(node.op(), operands, scope);
            }
        });
    }
}
