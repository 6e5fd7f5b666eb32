package io.github.cyfko.boolexpr.core.ast;

import io.github.cyfko.boolexpr.core.exception.ClauseStructureException;
import io.github.cyfko.boolexpr.core.parsing.ClauseMatch;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A single comparison between a parameter and one literal, or two literals for {@code between}.
 *
 * <h2>Canonical form</h2>
 * <pre>{@code
 * x > 5              → x>5
 * a between 3 and 5  → abetween3and5
 * flags & ~64        → flags&-65
 * }</pre>
 *
 * <h2>Bitwise negation</h2>
 * <p>
 * A literal written with a {@code ~} prefix is normalised when the clause is built: under the
 * bitwise operators {@code &} and {@code |} the numeral {@code n} becomes {@code -n-1}
 * (the two's complement of {@code n}); under any other operator the {@code ~} is dropped and the
 * numeral is kept as written.
 * </p>
 *
 * @param parameter referenced parameter
 * @param operator  one of {@link #OPERATORS}
 * @param value     first (or only) literal, as text
 * @param value2    upper bound, present if and only if {@code operator} is {@code between}
 * @since 1.0.0
 */
public record Condition(ParameterName parameter, String operator, String value, String value2) implements Expression {

    public static final String BETWEEN = "between";

    /** Every operator a condition may carry. */
    public static final Set<String> OPERATORS = Set.of("<", "<=", ">", ">=", "==", "=", "!=", "&", "|", BETWEEN);

    private static final String NULL_LITERAL = "null";

    public Condition {
        Objects.requireNonNull(parameter, "parameter cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (!OPERATORS.contains(operator)) {
            throw new ClauseStructureException("Unsupported operator: " + operator);
        }
        if (BETWEEN.equals(operator) != (value2 != null)) {
            throw new ClauseStructureException(BETWEEN.equals(operator)
                    ? "between condition on " + parameter + " requires an upper bound"
                    : "only between conditions carry a second value, got " + operator);
        }
    }

    public Condition(ParameterName parameter, String operator, String value) {
        this(parameter, operator, value, null);
    }

    /**
     * Clause action building a condition from a matched {@code condition} or
     * {@code between_condition} clause, applying the bitwise negation normalisation.
     *
     * @param match the raw clause fields
     * @return the condition node
     * @throws ClauseStructureException if the parameter is malformed or a negated bitwise operand
     *                                  is not an integer
     */
    public static Condition fromMatch(ClauseMatch match) {
        ParameterName parameter = ParameterName.parse(match.parameter());
        String operator = match.operator();

        String first = match.value() != null ? match.value() : match.value1();
        String second = match.value() != null ? null : match.value2();

        return new Condition(
                parameter,
                operator,
                normalize(first, operator),
                second != null ? normalize(second, operator) : null
        );
    }

    static String normalize(String literal, String operator) {
        if (literal == null || literal.indexOf('~') < 0) {
            return literal;
        }
        String stripped = literal.replace("~", "");
        if (!isBitwise(operator)) {
            return stripped;
        }
        try {
            return new BigInteger(stripped).negate().subtract(BigInteger.ONE).toString();
        } catch (NumberFormatException e) {
            throw new ClauseStructureException("bitwise operand " + literal + " is not an integer", e);
        }
    }

    private static boolean isBitwise(String operator) {
        return "&".equals(operator) || "|".equals(operator);
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

    public boolean isBetween() {
        return value2 != null;
    }

    public boolean isBitwise() {
        return isBitwise(operator);
    }

    /** @return {@code true} when the literal is the {@code null} keyword, ignoring case */
    public boolean isNullLiteral() {
        return NULL_LITERAL.equals(value.toLowerCase(Locale.ROOT));
    }

    /** @return the clause re-rendered with spaces, e.g. {@code x between 3 and 5} */
    public String inputClause() {
        if (isBetween()) {
            return fullname() + " " + BETWEEN + " " + value + " and " + value2;
        }
        return fullname() + " " + operator + " " + value;
    }

    @Override
    public String repr() {
        String repr = name() + operator + value;
        return isBetween() ? repr + "and" + value2 : repr;
    }

    @Override
    public Set<String> params() {
        return Set.of(fullname());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCondition(this);
    }

    @Override
    public String toString() {
        return repr();
    }
}
