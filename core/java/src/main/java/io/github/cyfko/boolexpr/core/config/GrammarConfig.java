package io.github.cyfko.boolexpr.core.config;

import io.github.cyfko.boolexpr.core.ast.Condition;
import io.github.cyfko.boolexpr.core.ast.Word;
import io.github.cyfko.boolexpr.core.parsing.ClauseAction;
import io.github.cyfko.boolexpr.core.parsing.ClauseGrammar;
import io.github.cyfko.boolexpr.core.parsing.ClauseRule;
import io.github.cyfko.boolexpr.core.parsing.Clauses;
import io.github.cyfko.boolexpr.core.parsing.CombinatorFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of what a parser recognises: the clause rules, tried in order at each
 * position (first match wins), and the factory building the {@code not}/{@code and}/{@code or}
 * nodes.
 *
 * <h2>Presets</h2>
 * <ul>
 *   <li>{@link #generic()}: between conditions, conditions and bare words</li>
 *   <li>{@link #criteria()}: between conditions and conditions only; a bare word is a syntax error</li>
 * </ul>
 *
 * <h2>Custom grammar</h2>
 * <pre>{@code
 * GrammarConfig config = GrammarConfig.builder()
 *     .name("flags-only")
 *     .clause(Clauses.CONDITION, Condition::fromMatch)
 *     .combinators((op, operands) -> new BooleanNode(op, operands))
 *     .build();
 * DslParser parser = new BasicDslParser(config, DslPolicy.strict());
 * }</pre>
 *
 * <p>A built instance is never mutated and can be shared by any number of parsers and threads.</p>
 *
 * @since 1.0.0
 */
public final class GrammarConfig {

    private static final GrammarConfig GENERIC = builder()
            .name("generic")
            .clause(Clauses.BETWEEN_CONDITION, Condition::fromMatch)
            .clause(Clauses.CONDITION, Condition::fromMatch)
            .clause(Clauses.WORD, Word::fromMatch)
            .build();

    private static final GrammarConfig CRITERIA = builder()
            .name("criteria")
            .clause(Clauses.BETWEEN_CONDITION, Condition::fromMatch)
            .clause(Clauses.CONDITION, Condition::fromMatch)
            .build();

    private final String name;
    private final List<ClauseRule> rules;
    private final CombinatorFactory combinators;

    private GrammarConfig(Builder builder) {
        this.name = builder.name;
        this.rules = List.copyOf(builder.rules);
        this.combinators = builder.combinators;
    }

    public static GrammarConfig generic() {
        return GENERIC;
    }

    public static GrammarConfig criteria() {
        return CRITERIA;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public List<ClauseRule> rules() {
        return rules;
    }

    public CombinatorFactory combinators() {
        return combinators;
    }

    /** @return a builder pre-filled with this configuration */
    public Builder toBuilder() {
        Builder builder = new Builder().name(name).combinators(combinators);
        builder.rules.addAll(rules);
        return builder;
    }

    @Override
    public String toString() {
        return "GrammarConfig[" + name + ", " + rules.size() + " clauses]";
    }

    public static final class Builder {
        private String name = "custom";
        private final List<ClauseRule> rules = new ArrayList<>();
        private CombinatorFactory combinators = CombinatorFactory.DEFAULT;

        private Builder() {}

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder clause(ClauseGrammar grammar, ClauseAction action) {
            rules.add(new ClauseRule(grammar, action));
            return this;
        }

        /**
         * Registers clause shapes together with their actions, pairing them by index.
         *
         * @throws IllegalArgumentException if both lists do not have the same size
         */
        public Builder clauses(List<? extends ClauseGrammar> grammars, List<? extends ClauseAction> actions) {
            if (grammars.size() != actions.size()) {
                throw new IllegalArgumentException(String.format(
                        "Each clause needs exactly one action: %d clauses, %d actions", grammars.size(), actions.size()));
            }
            for (int i = 0; i < grammars.size(); i++) {
                clause(grammars.get(i), actions.get(i));
            }
            return this;
        }

        public Builder combinators(CombinatorFactory combinators) {
            this.combinators = Objects.requireNonNull(combinators, "combinators");
            return this;
        }

        /**
         * @throws IllegalStateException if no clause has been registered
         */
        public GrammarConfig build() {
            if (rules.isEmpty()) {
                throw new IllegalStateException("At least one clause is required");
            }
            return new GrammarConfig(this);
        }
    }
}
