package io.github.cyfko.boolexpr.core.exception;

/**
 * Root of the unchecked exceptions raised while parsing a boolean expression or lowering it
 * into a backend predicate.
 * <p>
 * Every failure is terminal for the operation in progress: no partial expression tree and no
 * partial predicate is ever returned alongside one of these exceptions.
 * </p>
 *
 * @since 1.0.0
 * @see DSLSyntaxException
 * @see ClauseStructureException
 * @see FieldNotFoundException
 * @see ValueTypeException
 */
public class BoolExprException extends RuntimeException {

    public BoolExprException(String message) {
        super(message);
    }

    public BoolExprException(String message, Throwable cause) {
        super(message, cause);
    }
}
