package io.github.cyfko.boolexpr.core.ast;

import io.github.cyfko.boolexpr.core.parsing.ClauseMatch;

import java.util.Objects;
import java.util.Set;

/**
 * A bare parameter name standing on its own, e.g. {@code alpha} in
 * {@code "alpha and beta or not charlie"}. Backends read it as an implicit truthy test.
 *
 * @param parameter the referenced parameter
 * @since 1.0.0
 */
public record Word(ParameterName parameter) implements Expression {

    public Word {
        Objects.requireNonNull(parameter, "parameter cannot be null");
    }

    /**
     * Clause action building a word from a matched {@code word} clause.
     *
     * @param match the raw clause fields
     * @return the word node
     */
    public static Word fromMatch(ClauseMatch match) {
        return new Word(ParameterName.parse(match.parameter()));
    }

    public String name() {
        return parameter.name();
    }

    public String base() {
        return parameter.base();
    }

    public String fullname() {
        return parameter.fullname();
    }

    /** @return the clause as it would be written in an expression */
    public String inputClause() {
        return fullname();
    }

    @Override
    public String repr() {
        return name();
    }

    @Override
    public Set<String> params() {
        return Set.of(fullname());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitWord(this);
    }

    @Override
    public String toString() {
        return repr();
    }
}
