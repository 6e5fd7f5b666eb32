package io.github.cyfko.boolexpr.core.config;

import java.util.Objects;

/**
 * Behavioural knobs used when lowering conditions into backend predicates.
 * <p>
 * Defaults reproduce the historical behaviour: strings compared in lower case, {@code null} as
 * the null literal, {@code *} as the wildcard, and {@code bitand}/{@code bitor} as the names of
 * the database functions implementing the bitwise operators.
 * </p>
 */
public final class FilterConfig {

    private final StringCaseStrategy stringCaseStrategy;
    private final String nullLiteral;
    private final char wildcard;
    private final String bitAndFunction;
    private final String bitOrFunction;

    private FilterConfig(Builder builder) {
        this.stringCaseStrategy = builder.stringCaseStrategy;
        this.nullLiteral = builder.nullLiteral;
        this.wildcard = builder.wildcard;
        this.bitAndFunction = builder.bitAndFunction;
        this.bitOrFunction = builder.bitOrFunction;
    }

    public static Builder builder() { return new Builder(); }

    public static FilterConfig defaults() { return builder().build(); }

    public StringCaseStrategy getStringCaseStrategy() { return stringCaseStrategy; }
    public String getNullLiteral() { return nullLiteral; }
    public char getWildcard() { return wildcard; }
    public String getBitAndFunction() { return bitAndFunction; }
    public String getBitOrFunction() { return bitOrFunction; }

    /** @return {@code true} if {@code literal} is the configured null literal, ignoring case */
    public boolean isNullLiteral(String literal) {
        return literal != null && literal.equalsIgnoreCase(nullLiteral);
    }

    /**
     * Builder for {@link FilterConfig}.
     */
    public static final class Builder {
        private StringCaseStrategy stringCaseStrategy = StringCaseStrategy.LOWER;
        private String nullLiteral = "null";
        private char wildcard = '*';
        private String bitAndFunction = "bitand";
        private String bitOrFunction = "bitor";

        public Builder stringCaseStrategy(StringCaseStrategy strategy) {
            this.stringCaseStrategy = Objects.requireNonNull(strategy, "stringCaseStrategy");
            return this;
        }

        public Builder nullLiteral(String nullLiteral) {
            this.nullLiteral = Objects.requireNonNull(nullLiteral, "nullLiteral");
            return this;
        }

        public Builder wildcard(char wildcard) {
            this.wildcard = wildcard;
            return this;
        }

        public Builder bitAndFunction(String name) {
            this.bitAndFunction = Objects.requireNonNull(name, "bitAndFunction");
            return this;
        }

        public Builder bitOrFunction(String name) {
            this.bitOrFunction = Objects.requireNonNull(name, "bitOrFunction");
            return this;
        }

        public FilterConfig build() { return new FilterConfig(this); }
    }
}
