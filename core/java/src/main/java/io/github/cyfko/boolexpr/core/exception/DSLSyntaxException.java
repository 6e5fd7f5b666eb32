package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.api.DslParser;
import io.github.cyfko.boolexpr.core.impl.BasicDslParser;

/**
 * Exception thrown when an expression does not conform to the configured grammar.
 * <p>
 * Raised when no clause or boolean operator matches at some position of the input, when
 * unconsumed input remains after the longest valid expression, or when the input violates the
 * {@link io.github.cyfko.boolexpr.core.config.DslPolicy} limits.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // 1. Empty expression
 * parser.parse("");
 * // → "DSL expression cannot be null or empty"
 *
 * // 2. Missing operand
 * parser.parse("x > 5 and");
 * // → "Parsing syntax error (x > 5 and>!<) at line:1, col:10"
 *
 * // 3. Bare word with a parser that only knows conditions
 * BoolExpr.parse("stuff");
 * // → "Parsing syntax error (stuff>!<) at line:1, col:6"
 * }</pre>
 *
 * <p>
 * Positional errors expose the 1-based {@link #getLine() line} and {@link #getColumn() column}
 * of the failure together with the offending input line where the marker {@code >!<} has been
 * inserted at the failure column. Non positional errors report {@code -1} for both.
 * </p>
 *
 * @since 1.0.0
 * @see DslParser
 * @see BasicDslParser
 */
public class DSLSyntaxException extends BoolExprException {

    /** Marker inserted in the offending line at the failure column. */
    public static final String MARKER = ">!<";

    private final int line;
    private final int column;
    private final String markedLine;

    /**
     * Constructor with an explanatory error message and no position information.
     *
     * @param message the message describing the cause of the exception
     */
    public DSLSyntaxException(String message) {
        this(message, null);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public DSLSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
        this.markedLine = null;
    }

    private DSLSyntaxException(String message, int line, int column, String markedLine) {
        super(message);
        this.line = line;
        this.column = column;
        this.markedLine = markedLine;
    }

    /**
     * Builds a positional syntax error for the given input.
     *
     * @param input    the full text being parsed
     * @param position 0-based offset of the failure within {@code input}
     * @return the exception, ready to be thrown
     */
    public static DSLSyntaxException at(String input, int position) {
        int offset = Math.max(0, Math.min(position, input.length()));

        int lineStart = input.lastIndexOf('\n', offset - 1) + 1;
        int lineEnd = input.indexOf('\n', offset);
        if (lineEnd < 0) {
            lineEnd = input.length();
        }

        int line = 1;
        for (int i = 0; i < lineStart; i++) {
            if (input.charAt(i) == '\n') line++;
        }
        int column = offset - lineStart + 1;

        String marked = input.substring(lineStart, offset) + MARKER + input.substring(offset, lineEnd);
        String message = String.format("Parsing syntax error (%s) at line:%d, col:%d", marked, line, column);
        return new DSLSyntaxException(message, line, column, marked);
    }

    /** @return 1-based line of the failure, or {@code -1} when not positional */
    public int getLine() {
        return line;
    }

    /** @return 1-based column of the failure, or {@code -1} when not positional */
    public int getColumn() {
        return column;
    }

    /** @return offending input line annotated with {@link #MARKER}, or {@code null} when not positional */
    public String getMarkedLine() {
        return markedLine;
    }
}
