package io.github.cyfko.boolexpr.core.parsing;

import java.util.Objects;

/**
 * Raw fields captured by a {@link ClauseGrammar}, before any AST node is built.
 * Absent fields are {@code null}.
 *
 * @param parameter the dotted parameter name, always present
 * @param operator  the comparison operator, or {@code between}
 * @param value     the literal of a binary condition
 * @param value1    the lower bound of a between condition
 * @param value2    the upper bound of a between condition
 * @since 1.0.0
 */
public record ClauseMatch(String parameter, String operator, String value, String value1, String value2) {

    public ClauseMatch {
        Objects.requireNonNull(parameter, "parameter cannot be null");
    }

    public static ClauseMatch word(String parameter) {
        return new ClauseMatch(parameter, null, null, null, null);
    }

    public static ClauseMatch condition(String parameter, String operator, String value) {
        return new ClauseMatch(parameter, operator, value, null, null);
    }

    public static ClauseMatch between(String parameter, String value1, String value2) {
        return new ClauseMatch(parameter, Lexicon.BETWEEN, null, value1, value2);
    }
}
