package io.github.cyfko.boolexpr.core.parsing;

import java.util.Objects;

/**
 * A clause grammar paired with the action building its node.
 *
 * @param grammar the clause shape
 * @param action  the node constructor
 * @since 1.0.0
 */
public record ClauseRule(ClauseGrammar grammar, ClauseAction action) {

    public ClauseRule {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
    }
}
