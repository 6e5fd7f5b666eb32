package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.api.ValueDomain;

/**
 * Exception thrown during lowering when a literal cannot be coerced into the value domain of the
 * field it is compared with.
 *
 * <pre>{@code
 * // "x > five" where x is an integer column
 * // → "Field x expects a INTEGER value. Received five instead."
 * }</pre>
 *
 * @since 1.0.0
 */
public class ValueTypeException extends BoolExprException {

    private final String field;
    private final ValueDomain expected;
    private final String literal;

    public ValueTypeException(String field, ValueDomain expected, String literal) {
        this(field, expected, literal, null);
    }

    public ValueTypeException(String field, ValueDomain expected, String literal, Throwable cause) {
        super(String.format("Field %s expects a %s value. Received %s instead.", field, expected, literal), cause);
        this.field = field;
        this.expected = expected;
        this.literal = literal;
    }

    public String getField() {
        return field;
    }

    public ValueDomain getExpected() {
        return expected;
    }

    public String getLiteral() {
        return literal;
    }
}
