package io.github.cyfko.boolexpr.jpa.spi;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Functional interface for resolving a parsed expression into a JPA Criteria API predicate.
 * <p>
 * {@code PredicateResolver} represents a <strong>deferred predicate generator</strong>:
 * it holds the expression and builds the {@link Predicate} on demand, once the query context
 * (root, query, criteria builder) is known. The same resolver can be applied to any number of
 * queries.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * PredicateResolver<ModelA> resolver = context.toResolver(BoolExpr.parse("modela.x > 5").root());
 *
 * CriteriaBuilder cb = entityManager.getCriteriaBuilder();
 * CriteriaQuery<ModelA> query = cb.createQuery(ModelA.class);
 * Root<ModelA> root = query.from(ModelA.class);
 *
 * query.where(resolver.resolve(root, query, cb));
 * List<ModelA> results = entityManager.createQuery(query).getResultList();
 * }</pre>
 *
 * <p><em>Composition:</em></p>
 * <pre>{@code
 * PredicateResolver<ModelA> combined = (root, query, cb) -> cb.and(
 *     first.resolve(root, query, cb),
 *     second.resolve(root, query, cb)
 * );
 * }</pre>
 *
 * @param <E> the entity type the predicate applies to
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Builds the predicate for the given query context.
     *
     * @param root            the root entity in the criteria query
     * @param query           the criteria query being constructed
     * @param criteriaBuilder the JPA criteria builder for predicate construction
     * @return the predicate, never {@code null}
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder criteriaBuilder);
}
