package io.github.cyfko.boolexpr.core.spi;

import io.github.cyfko.boolexpr.core.ast.ParameterName;

import java.util.Optional;

/**
 * Looks up the field a parameter refers to within one candidate source.
 *
 * @param <S> source descriptor (table, entity root...)
 * @param <F> typed field handle
 * @since 1.0.0
 */
@FunctionalInterface
public interface FieldResolver<S, F> {

    /**
     * @param parameter the referenced parameter; its base, when present, must designate the source
     * @param source    the candidate source
     * @return the comparable field, or empty when the source does not expose it
     */
    Optional<F> resolve(ParameterName parameter, S source);

    /** @return a readable label of the source, used in not-found errors */
    default String describe(S source) {
        return String.valueOf(source);
    }
}
