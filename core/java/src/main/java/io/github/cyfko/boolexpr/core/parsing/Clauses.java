package io.github.cyfko.boolexpr.core.parsing;

import java.util.Optional;

/**
 * Built-in clause shapes, in the order parsers try them.
 *
 * <pre>{@code
 * BETWEEN_CONDITION   age between 18 and 65
 * CONDITION           modela.x >= 5
 * WORD                active
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Clauses {

    /** {@code name between value and value}. */
    public static final ClauseGrammar BETWEEN_CONDITION = cursor -> {
        int mark = cursor.position();
        String parameter = parameter(cursor);
        if (parameter != null && Lexicon.keyword(cursor, Lexicon.BETWEEN)) {
            String lower = Lexicon.value(cursor);
            if (lower != null && Lexicon.keyword(cursor, Lexicon.AND)) {
                String upper = Lexicon.value(cursor);
                if (upper != null) {
                    return Optional.of(ClauseMatch.between(parameter, lower, upper));
                }
            }
        }
        cursor.reset(mark);
        return Optional.empty();
    };

    /** {@code name operator value}. */
    public static final ClauseGrammar CONDITION = cursor -> {
        int mark = cursor.position();
        String parameter = parameter(cursor);
        if (parameter != null) {
            String operator = Lexicon.operator(cursor);
            if (operator != null) {
                String value = Lexicon.value(cursor);
                if (value != null) {
                    return Optional.of(ClauseMatch.condition(parameter, operator, value));
                }
            }
        }
        cursor.reset(mark);
        return Optional.empty();
    };

    /** A lone name. */
    public static final ClauseGrammar WORD = cursor -> Optional.ofNullable(parameter(cursor)).map(ClauseMatch::word);

    private Clauses() {
    }

    /**
     * Matches a parameter name. Keywords are reserved and never name a parameter.
     */
    public static String parameter(InputCursor cursor) {
        int mark = cursor.position();
        String name = Lexicon.name(cursor);
        if (name != null && Lexicon.isKeyword(name)) {
            cursor.reset(mark);
            cursor.skipWhitespace();
            cursor.fail();
            cursor.reset(mark);
            return null;
        }
        return name;
    }
}
