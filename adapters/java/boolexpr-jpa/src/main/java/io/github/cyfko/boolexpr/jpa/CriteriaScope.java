package io.github.cyfko.boolexpr.jpa;

import jakarta.persistence.criteria.AbstractQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.From;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to build predicates for one query: the criteria builder, the query (used to
 * open subqueries) and the candidate sources fields are looked up in, in priority order.
 *
 * @param criteriaBuilder the builder creating predicates
 * @param query           the query the predicates belong to
 * @param sources         roots and joins that may expose the referenced fields, tried in order
 * @since 1.0.0
 */
public record CriteriaScope(CriteriaBuilder criteriaBuilder, AbstractQuery<?> query, List<From<?, ?>> sources) {

    public CriteriaScope {
        Objects.requireNonNull(criteriaBuilder, "criteriaBuilder cannot be null");
        Objects.requireNonNull(query, "query cannot be null");
        Objects.requireNonNull(sources, "sources cannot be null");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one source is required");
        }
        sources = List.copyOf(sources);
    }

    public static CriteriaScope of(CriteriaBuilder criteriaBuilder, AbstractQuery<?> query, From<?, ?>... sources) {
        return new CriteriaScope(criteriaBuilder, query, List.of(sources));
    }
}
