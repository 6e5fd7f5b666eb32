package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.config.GrammarConfig;

/**
 * Preconfigured grammars.
 *
 * @since 1.0.0
 */
public enum ParserFlavor {

    /** Conditions, between conditions and bare words. */
    GENERIC,

    /** Conditions and between conditions, as lowered into query predicates. */
    CRITERIA;

    public GrammarConfig grammar() {
        return this == GENERIC ? GrammarConfig.generic() : GrammarConfig.criteria();
    }
}
