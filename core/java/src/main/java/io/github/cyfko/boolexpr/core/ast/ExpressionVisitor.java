package io.github.cyfko.boolexpr.core.ast;

/**
 * Exhaustive dispatch over the {@link Expression} variants.
 *
 * @param <R> result type of the traversal
 * @since 1.0.0
 */
public interface ExpressionVisitor<R> {

    R visitWord(Word word);

    R visitCondition(Condition condition);

    R visitBoolean(BooleanNode node);
}
