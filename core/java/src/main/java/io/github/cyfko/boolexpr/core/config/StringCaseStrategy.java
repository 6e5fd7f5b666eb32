package io.github.cyfko.boolexpr.core.config;

/**
 * Strategy for handling string case when comparing string fields.
 */
public enum StringCaseStrategy {
    /** Do not change case (use value as provided). */
    NONE,
    /** Convert both field and value to lower case before comparing. */
    LOWER,
    /** Convert both field and value to upper case before comparing. */
    UPPER
}
