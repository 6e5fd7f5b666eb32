package io.github.cyfko.boolexpr.core.utils;

import io.github.cyfko.boolexpr.core.api.ValueDomain;
import io.github.cyfko.boolexpr.core.config.StringCaseStrategy;
import io.github.cyfko.boolexpr.core.exception.ValueTypeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Coerces the textual literals of a condition into the Java type of the field they are
 * compared with.
 *
 * <h2>Coercion Rules</h2>
 * <dl>
 *   <dt><strong>Numeric</strong></dt>
 *   <dd>Parsed into the field's exact numeral type (Integer, Long, Double, BigDecimal...).</dd>
 *
 *   <dt><strong>Boolean</strong></dt>
 *   <dd>{@code true, t, 1, yes} and {@code false, f, 0, no}, ignoring case.</dd>
 *
 *   <dt><strong>Date</strong></dt>
 *   <dd>The first 10 characters, as an ISO-8601 date.</dd>
 *
 *   <dt><strong>Datetime</strong></dt>
 *   <dd>
 *     A full ISO-8601 date-time, with or without offset; the {@code T} separator may be a space.
 *     A date alone stands for the start of that day.
 *   </dd>
 *
 *   <dt><strong>String</strong></dt>
 *   <dd>Left untouched, except for enum and UUID fields which are converted.</dd>
 * </dl>
 *
 * <p>Every failure raises a {@link ValueTypeException} naming the field, the expected domain
 * and the received literal.</p>
 *
 * @since 1.0.0
 * @see ValueDomain
 */
public final class TypeConversionUtils {

    private static final Set<String> TRUE_WORDS = Set.of("true", "t", "1", "yes");
    private static final Set<String> FALSE_WORDS = Set.of("false", "f", "0", "no");

    private TypeConversionUtils() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Converts {@code literal} into an instance of {@code targetType}.
     *
     * @param field      full name of the field, for error reporting
     * @param literal    the condition literal
     * @param targetType the field's Java type, primitive or boxed
     * @return the converted value, boxed
     * @throws ValueTypeException if the literal does not fit the field's domain
     */
    public static Object coerce(String field, String literal, Class<?> targetType) {
        ValueDomain domain = ValueDomain.of(targetType);
        Class<?> type = box(targetType);
        try {
            return switch (domain) {
                case INTEGER -> toInteger(type, literal);
                case FLOAT -> toFloating(type, literal);
                case DECIMAL -> new BigDecimal(literal);
                case BOOLEAN -> toBoolean(field, literal);
                case DATE -> toDate(type, literal);
                case DATETIME -> toDateTime(type, literal);
                case STRING -> toText(type, literal);
            };
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ValueTypeException(field, domain, literal, e);
        }
    }

    /**
     * Parses a bitwise mask for an integer field.
     *
     * @throws ValueTypeException if the literal is not an integer
     */
    public static Object coerceMask(String field, String literal, Class<?> targetType) {
        if (ValueDomain.of(targetType) != ValueDomain.INTEGER) {
            throw new ValueTypeException(field, ValueDomain.of(targetType), literal);
        }
        return coerce(field, literal, targetType);
    }

    /**
     * Applies a string case strategy.
     *
     * @param value    the text to transform
     * @param strategy the case strategy to apply
     * @return the transformed text
     */
    public static String applyStringCaseStrategy(String value, StringCaseStrategy strategy) {
        if (value == null || strategy == null) {
            return value;
        }
        return switch (strategy) {
            case LOWER -> value.toLowerCase(Locale.ROOT);
            case UPPER -> value.toUpperCase(Locale.ROOT);
            case NONE -> value;
        };
    }

    /**
     * @return the wrapper class of a primitive type, or {@code type} itself
     */
    public static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }

    private static Object toInteger(Class<?> type, String literal) {
        if (type == Integer.class) return Integer.valueOf(literal);
        if (type == Long.class) return Long.valueOf(literal);
        if (type == Short.class) return Short.valueOf(literal);
        if (type == Byte.class) return Byte.valueOf(literal);
        return new BigInteger(literal);
    }

    private static Object toFloating(Class<?> type, String literal) {
        if (type == Float.class) return Float.valueOf(literal);
        return Double.valueOf(literal);
    }

    private static Boolean toBoolean(String field, String literal) {
        String word = literal.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) return Boolean.TRUE;
        if (FALSE_WORDS.contains(word)) return Boolean.FALSE;
        throw new ValueTypeException(field, ValueDomain.BOOLEAN, literal);
    }

    private static Object toDate(Class<?> type, String literal) {
        String prefix = literal.length() > 10 ? literal.substring(0, 10) : literal;
        LocalDate date = LocalDate.parse(prefix);
        return type == java.sql.Date.class ? java.sql.Date.valueOf(date) : date;
    }

    private static Object toDateTime(Class<?> type, String literal) {
        String iso = literal.length() > 10 && literal.charAt(10) == ' '
                ? literal.substring(0, 10) + 'T' + literal.substring(11)
                : literal;

        OffsetDateTime offset = null;
        LocalDateTime local;
        if (iso.length() == 10) {
            local = LocalDate.parse(iso).atStartOfDay();
        } else if (hasOffset(iso)) {
            offset = OffsetDateTime.parse(iso);
            local = offset.toLocalDateTime();
        } else {
            local = LocalDateTime.parse(iso);
        }

        if (type == LocalDateTime.class) return local;
        if (type == Timestamp.class) return Timestamp.valueOf(local);

        OffsetDateTime absolute = offset != null ? offset : local.atOffset(ZoneOffset.UTC);
        if (type == OffsetDateTime.class) return absolute;
        if (type == ZonedDateTime.class) return absolute.toZonedDateTime();
        if (type == Instant.class) return absolute.toInstant();
        if (Date.class.isAssignableFrom(type)) return Date.from(absolute.toInstant());
        return local;
    }

    private static boolean hasOffset(String iso) {
        int timeStart = iso.indexOf('T');
        if (timeStart < 0) return false;
        String time = iso.substring(timeStart);
        return time.endsWith("Z") || time.indexOf('+') > 0 || time.indexOf('-') > 0;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object toText(Class<?> type, String literal) {
        if (type.isEnum()) {
            for (Object constant : type.getEnumConstants()) {
                if (((Enum) constant).name().equalsIgnoreCase(literal)) {
                    return constant;
                }
            }
            throw new IllegalArgumentException("No enum constant " + type.getSimpleName() + "." + literal);
        }
        if (type == UUID.class) {
            return UUID.fromString(literal);
        }
        return literal;
    }
}
