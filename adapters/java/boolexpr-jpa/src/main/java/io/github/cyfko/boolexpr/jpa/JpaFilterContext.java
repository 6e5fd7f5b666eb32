package io.github.cyfko.boolexpr.jpa;

import io.github.cyfko.boolexpr.core.api.ValueDomain;
import io.github.cyfko.boolexpr.core.ast.Condition;
import io.github.cyfko.boolexpr.core.ast.Expression;
import io.github.cyfko.boolexpr.core.ast.LogicOp;
import io.github.cyfko.boolexpr.core.ast.ParameterName;
import io.github.cyfko.boolexpr.core.ast.Word;
import io.github.cyfko.boolexpr.core.config.FilterConfig;
import io.github.cyfko.boolexpr.core.exception.FieldNotFoundException;
import io.github.cyfko.boolexpr.core.spi.ExpressionLowering;
import io.github.cyfko.boolexpr.core.spi.FieldResolver;
import io.github.cyfko.boolexpr.core.utils.TypeConversionUtils;
import io.github.cyfko.boolexpr.jpa.spi.PredicateResolver;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import jakarta.persistence.metamodel.Metamodel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lowers parsed expressions into JPA Criteria {@link Predicate}s.
 *
 * <h2>Field resolution</h2>
 * <p>
 * Every condition is resolved against the sources of the {@link CriteriaScope}, in order; the
 * first source exposing a comparable field wins. When none does, a
 * {@link FieldNotFoundException} lists the field and every source tried.
 * </p>
 *
 * <h2>Operator mapping</h2>
 * <table border="1">
 * <caption>Condition to predicate</caption>
 * <tr><th>Operator</th><th>String field</th><th>Other fields</th></tr>
 * <tr><td>{@code < <= > >=}</td><td>case-folded comparison</td><td>comparison</td></tr>
 * <tr><td>{@code ==}</td><td>case-folded equality</td><td>equality</td></tr>
 * <tr><td>{@code =}</td><td>case-folded {@code LIKE}; {@code *} is the wildcard, none means "contains"</td><td>equality</td></tr>
 * <tr><td>{@code !=}</td><td>case-folded inequality</td><td>inequality</td></tr>
 * <tr><td>{@code between}</td><td>inclusive range</td><td>inclusive range</td></tr>
 * <tr><td>{@code & |}</td><td>n/a</td><td>{@code bitand(field, mask) <> 0}, integers only</td></tr>
 * </table>
 * <p>
 * The null literal turns {@code =} and {@code ==} into {@code IS NULL} and {@code !=} into
 * {@code IS NOT NULL}. On an element collection the condition holds when some element
 * satisfies it, and the null literal tests for an empty collection.
 * </p>
 * <p>
 * A bare word holds when a boolean field is true, or when any other field is not null.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JpaFilterContext context = new JpaFilterContext(entityManager.getMetamodel());
 *
 * CriteriaBuilder cb = entityManager.getCriteriaBuilder();
 * CriteriaQuery<ModelA> query = cb.createQuery(ModelA.class);
 * Root<ModelA> root = query.from(ModelA.class);
 *
 * Expression expr = BoolExpr.parse("modela.x > 5 and modela.name = foo*").root();
 * query.where(context.filter(expr, CriteriaScope.of(cb, query, root)));
 * }</pre>
 *
 * <p>Instances hold no per-query state and can be shared.</p>
 *
 * @since 1.0.0
 */
public class JpaFilterContext implements ExpressionLowering<Predicate, CriteriaScope> {

    private static final Logger logger = Logger.getLogger(JpaFilterContext.class.getName());

    private static final char ESCAPE = '\\';

    private final FieldResolver<From<?, ?>, FieldHandle> fieldResolver;
    private final FilterConfig filterConfig;

    public JpaFilterContext(Metamodel metamodel) {
        this(metamodel, FilterConfig.defaults());
    }

    public JpaFilterContext(Metamodel metamodel, FilterConfig filterConfig) {
        this(new MetamodelFieldResolver(metamodel), filterConfig);
    }

    /**
     * @param fieldResolver the lookup of fields within one source
     * @param filterConfig  string case, null literal, wildcard and bitwise function settings
     */
    public JpaFilterContext(FieldResolver<From<?, ?>, FieldHandle> fieldResolver, FilterConfig filterConfig) {
        this.fieldResolver = Objects.requireNonNull(fieldResolver, "fieldResolver cannot be null");
        this.filterConfig = Objects.requireNonNull(filterConfig, "filterConfig cannot be null");
    }

    public FilterConfig getFilterConfig() {
        return filterConfig;
    }

    /**
     * Lowers a whole expression.
     *
     * @throws FieldNotFoundException if a parameter resolves on none of the sources
     * @throws io.github.cyfko.boolexpr.core.exception.ValueTypeException if a literal does not
     *         fit its field
     */
    public Predicate filter(Expression expression, CriteriaScope scope) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(scope, "scope cannot be null");
        return lower(expression, scope);
    }

    /**
     * Defers lowering until the query context is known. The root is the only source.
     *
     * @param expression the expression to lower
     * @param <E>        the root entity type
     * @return a reusable resolver
     */
    public <E> PredicateResolver<E> toResolver(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return (root, query, cb) -> filter(expression, CriteriaScope.of(cb, query, root));
    }

    /**
     * Finds the first source exposing {@code parameter}.
     *
     * @throws FieldNotFoundException if no source does
     */
    public FieldHandle resolveField(ParameterName parameter, List<From<?, ?>> sources) {
        List<String> tried = new ArrayList<>(sources.size());
        for (From<?, ?> source : sources) {
            Optional<FieldHandle> handle = fieldResolver.resolve(parameter, source);
            if (handle.isPresent()) {
                logger.log(Level.FINE, () -> "Resolved " + parameter + " on " + fieldResolver.describe(source));
                return handle.get();
            }
            tried.add(fieldResolver.describe(source));
        }
        throw new FieldNotFoundException(parameter.fullname(), tried);
    }

    @Override
    public Predicate lowerCondition(Condition condition, CriteriaScope scope) {
        FieldHandle field = resolveField(condition.parameter(), scope.sources());
        CriteriaBuilder cb = scope.criteriaBuilder();

        if (!field.collection()) {
            return compare(field.path(), field, condition, cb);
        }

        if (!condition.isBetween() && filterConfig.isNullLiteral(condition.value())) {
            jakarta.persistence.criteria.Expression<Collection<?>> elements = castToCollection(field.path());
            switch (condition.operator()) {
                case "=", "==" -> {
                    return cb.isEmpty(elements);
                }
                case "!=" -> {
                    return cb.isNotEmpty(elements);
                }
                default -> {
                    // compared element by element below
                }
            }
        }
        return anyElement(field, scope, element -> compare(element, field, condition, cb));
    }

    @Override
    public Predicate lowerWord(Word word, CriteriaScope scope) {
        FieldHandle field = resolveField(word.parameter(), scope.sources());
        CriteriaBuilder cb = scope.criteriaBuilder();
        if (field.collection()) {
            return cb.isNotEmpty(castToCollection(field.path()));
        }
        if (field.domain() == ValueDomain.BOOLEAN) {
            return cb.isTrue(castToBoolean(field.path()));
        }
        return cb.isNotNull(field.path());
    }

    @Override
    public Predicate combine(LogicOp op, List<Predicate> operands, CriteriaScope scope) {
        CriteriaBuilder cb = scope.criteriaBuilder();
        return switch (op) {
            case NOT -> cb.not(operands.get(0));
            case AND -> cb.and(operands.toArray(new Predicate[0]));
            case OR -> cb.or(operands.toArray(new Predicate[0]));
        };
    }

    // ========================================
    // Scalar comparisons
    // ========================================

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Predicate compare(jakarta.persistence.criteria.Expression<?> target, FieldHandle field,
                              Condition condition, CriteriaBuilder cb) {
        String name = condition.fullname();
        String operator = condition.operator();

        if (!condition.isBetween() && filterConfig.isNullLiteral(condition.value())) {
            switch (operator) {
                case "=", "==" -> {
                    return cb.isNull(target);
                }
                case "!=" -> {
                    return cb.isNotNull(target);
                }
                default -> {
                    // the literal is compared as text
                }
            }
        }

        if (condition.isBitwise()) {
            Object mask = TypeConversionUtils.coerceMask(name, condition.value(), field.javaType());
            Object zero = TypeConversionUtils.coerce(name, "0", field.javaType());
            String function = "&".equals(operator) ? filterConfig.getBitAndFunction() : filterConfig.getBitOrFunction();
            Class<?> type = TypeConversionUtils.box(field.javaType());
            return cb.notEqual(cb.function(function, type, target, cb.literal(mask)), zero);
        }

        if (field.javaType() == String.class) {
            return compareText((jakarta.persistence.criteria.Expression<String>) target, condition, cb);
        }

        Comparable value = (Comparable) TypeConversionUtils.coerce(name, condition.value(), field.javaType());
        jakarta.persistence.criteria.Expression comparable = target;
        return switch (operator) {
            case "=", "==" -> cb.equal(target, value);
            case "!=" -> cb.notEqual(target, value);
            case "<" -> cb.lessThan(comparable, value);
            case "<=" -> cb.lessThanOrEqualTo(comparable, value);
            case ">" -> cb.greaterThan(comparable, value);
            case ">=" -> cb.greaterThanOrEqualTo(comparable, value);
            case Condition.BETWEEN -> cb.between(comparable, value,
                    (Comparable) TypeConversionUtils.coerce(name, condition.value2(), field.javaType()));
            default -> throw new IllegalStateException("Unexpected operator: " + operator);
        };
    }

    private Predicate compareText(jakarta.persistence.criteria.Expression<String> target, Condition condition,
                                  CriteriaBuilder cb) {
        jakarta.persistence.criteria.Expression<String> folded = switch (filterConfig.getStringCaseStrategy()) {
            case LOWER -> cb.lower(target);
            case UPPER -> cb.upper(target);
            case NONE -> target;
        };
        String value = fold(condition.value());

        return switch (condition.operator()) {
            case "==" -> cb.equal(folded, value);
            case "=" -> cb.like(folded, toLikePattern(value), ESCAPE);
            case "!=" -> cb.notEqual(folded, value);
            case "<" -> cb.lessThan(folded, value);
            case "<=" -> cb.lessThanOrEqualTo(folded, value);
            case ">" -> cb.greaterThan(folded, value);
            case ">=" -> cb.greaterThanOrEqualTo(folded, value);
            case Condition.BETWEEN -> cb.between(folded, value, fold(condition.value2()));
            default -> throw new IllegalStateException("Unexpected operator: " + condition.operator());
        };
    }

    private String fold(String value) {
        return TypeConversionUtils.applyStringCaseStrategy(value, filterConfig.getStringCaseStrategy());
    }

    /**
     * Escapes the SQL wildcards of {@code value}, then maps the configured wildcard to {@code %}.
     * A value without wildcard matches as a substring.
     */
    String toLikePattern(String value) {
        char wildcard = filterConfig.getWildcard();
        StringBuilder pattern = new StringBuilder(value.length() + 2);
        boolean hasWildcard = false;
        for (char c : value.toCharArray()) {
            if (c == wildcard) {
                pattern.append('%');
                hasWildcard = true;
            } else if (c == '%' || c == '_' || c == ESCAPE) {
                pattern.append(ESCAPE).append(c);
            } else {
                pattern.append(c);
            }
        }
        return hasWildcard ? pattern.toString() : "%" + pattern + "%";
    }

    // ========================================
    // Element collections
    // ========================================

    /**
     * {@code EXISTS (SELECT 1 FROM source.attribute e WHERE test(e))}, correlated with the source.
     */
    private Predicate anyElement(FieldHandle field, CriteriaScope scope,
                                 Function<jakarta.persistence.criteria.Expression<?>, Predicate> test) {
        CriteriaBuilder cb = scope.criteriaBuilder();
        Subquery<Integer> subquery = scope.query().subquery(Integer.class);
        From<?, ?> correlated = correlate(subquery, field.source());
        Join<?, ?> element = correlated.join(field.attributeName());
        subquery.select(cb.literal(1)).where(test.apply(element));
        return cb.exists(subquery);
    }

    private static From<?, ?> correlate(Subquery<?> subquery, From<?, ?> source) {
        if (source instanceof Root<?> root) {
            return subquery.correlate(root);
        }
        if (source instanceof Join<?, ?> join) {
            return subquery.correlate(join);
        }
        throw new IllegalArgumentException("Cannot correlate source of type " + source.getClass().getName());
    }

    // ========================================
    // JPA-Specific Safe Casting Methods
    // ========================================

    @SuppressWarnings("unchecked")
    private static jakarta.persistence.criteria.Expression<Collection<?>> castToCollection(
            jakarta.persistence.criteria.Expression<?> expression) {
        return (jakarta.persistence.criteria.Expression<Collection<?>>) expression;
    }

    @SuppressWarnings("unchecked")
    private static jakarta.persistence.criteria.Expression<Boolean> castToBoolean(
            jakarta.persistence.criteria.Expression<?> expression) {
        return (jakarta.persistence.criteria.Expression<Boolean>) expression;
    }
}
