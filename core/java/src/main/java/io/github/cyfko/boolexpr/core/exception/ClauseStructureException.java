package io.github.cyfko.boolexpr.core.exception;

/**
 * Exception thrown when a clause matched the grammar but carries semantically invalid data,
 * such as a parameter name with more than one {@code .} separator.
 *
 * @since 1.0.0
 */
public class ClauseStructureException extends BoolExprException {

    public ClauseStructureException(String message) {
        super(message);
    }

    public ClauseStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
