package io.github.cyfko.boolexpr.core.ast;

import java.util.Locale;

/**
 * Boolean operators, listed from the tightest to the loosest binding:
 * {@code not} &gt; {@code and} &gt; {@code or}.
 *
 * @since 1.0.0
 */
public enum LogicOp {
    NOT("not"),
    AND("and"),
    OR("or");

    private final String keyword;

    LogicOp(String keyword) {
        this.keyword = keyword;
    }

    /** @return the lower-case keyword spelling the operator in an expression */
    public String keyword() {
        return keyword;
    }

    public boolean isUnary() {
        return this == NOT;
    }

    /**
     * @param keyword operator keyword, case-insensitive
     * @return the matching operator
     * @throws IllegalArgumentException if the keyword is not a boolean operator
     */
    public static LogicOp fromKeyword(String keyword) {
        if (keyword != null) {
            String lower = keyword.toLowerCase(Locale.ROOT);
            for (LogicOp op : values()) {
                if (op.keyword.equals(lower)) return op;
            }
        }
        throw new IllegalArgumentException("Unknown boolean operator: " + keyword);
    }
}
