package io.github.cyfko.boolexpr.core.api;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Family of values a field holds, which decides how literals are coerced before comparison.
 *
 * @since 1.0.0
 */
public enum ValueDomain {
    INTEGER,
    FLOAT,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATETIME,
    STRING;

    /**
     * Classifies a Java type. Anything that is not numeric, boolean or temporal is a
     * {@link #STRING}.
     *
     * @param type the field's Java type, primitive or boxed
     * @return the value domain
     */
    public static ValueDomain of(Class<?> type) {
        if (type == Integer.class || type == int.class
                || type == Long.class || type == long.class
                || type == Short.class || type == short.class
                || type == Byte.class || type == byte.class
                || type == BigInteger.class) {
            return INTEGER;
        }
        if (type == Double.class || type == double.class || type == Float.class || type == float.class) {
            return FLOAT;
        }
        if (type == BigDecimal.class) {
            return DECIMAL;
        }
        if (type == Boolean.class || type == boolean.class) {
            return BOOLEAN;
        }
        if (type == LocalDate.class || type == java.sql.Date.class) {
            return DATE;
        }
        if (type == LocalDateTime.class || type == OffsetDateTime.class || type == ZonedDateTime.class
                || type == Instant.class || Date.class.isAssignableFrom(type)) {
            return DATETIME;
        }
        return STRING;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == DECIMAL;
    }
}
