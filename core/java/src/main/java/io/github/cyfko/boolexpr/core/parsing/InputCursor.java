package io.github.cyfko.boolexpr.core.parsing;

import java.util.Objects;

/**
 * Mutable read position over an expression being parsed.
 * <p>
 * One cursor is created per parse call and never shared, which keeps the parser reentrant.
 * Besides the current position, the cursor remembers the furthest offset where an atom failed
 * to match; that offset is what syntax errors report.
 * </p>
 *
 * @since 1.0.0
 */
public final class InputCursor {

    private final String text;
    private int position;
    private int furthestFailure;

    public InputCursor(String text) {
        this.text = Objects.requireNonNull(text, "text cannot be null");
    }

    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    /** Moves back (or forward) to a previously saved position. */
    public void reset(int position) {
        if (position < 0 || position > text.length()) {
            throw new IndexOutOfBoundsException("position " + position + " outside [0, " + text.length() + "]");
        }
        this.position = position;
    }

    public void advance(int count) {
        reset(position + count);
    }

    public void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    public boolean atEnd() {
        return position >= text.length();
    }

    /**
     * Consumes {@code expected} after optional whitespace.
     *
     * @return {@code true} if the character was consumed, otherwise the cursor is left untouched
     */
    public boolean consume(char expected) {
        int mark = position;
        skipWhitespace();
        if (position < text.length() && text.charAt(position) == expected) {
            position++;
            return true;
        }
        fail();
        reset(mark);
        return false;
    }

    /** Records the current position as a failure point. */
    public void fail() {
        furthestFailure = Math.max(furthestFailure, position);
    }

    public int furthestFailure() {
        return furthestFailure;
    }

    @Override
    public String toString() {
        return text.substring(0, position) + "|" + text.substring(position);
    }
}
