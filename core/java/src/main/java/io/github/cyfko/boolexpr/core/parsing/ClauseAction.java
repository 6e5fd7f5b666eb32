package io.github.cyfko.boolexpr.core.parsing;

import io.github.cyfko.boolexpr.core.ast.Expression;

/**
 * Turns the raw fields of a matched clause into an AST node.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClauseAction {

    /**
     * @param match the clause fields
     * @return the node standing for the clause
     * @throws io.github.cyfko.boolexpr.core.exception.ClauseStructureException if the fields are
     *         well-formed text but do not make a valid clause
     */
    Expression apply(ClauseMatch match);
}
