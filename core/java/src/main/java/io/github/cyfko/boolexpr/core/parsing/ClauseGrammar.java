package io.github.cyfko.boolexpr.core.parsing;

import java.util.Optional;

/**
 * Recognises one clause shape at the cursor position.
 * <p>
 * Implementations must either advance the cursor past the clause and return its fields, or
 * return {@link Optional#empty()} with the cursor at the position it had on entry.
 * </p>
 *
 * @since 1.0.0
 * @see Clauses
 */
@FunctionalInterface
public interface ClauseGrammar {

    Optional<ClauseMatch> match(InputCursor cursor);
}
