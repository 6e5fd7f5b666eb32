package io.github.cyfko.boolexpr.jpa;

import io.github.cyfko.boolexpr.core.api.ValueDomain;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Path;

import java.util.Objects;

/**
 * A resolved, comparable field.
 *
 * @param source        the root or join exposing the attribute
 * @param attributeName the persistent attribute name
 * @param javaType      the attribute type, or the element type for a collection
 * @param domain        the value domain of {@code javaType}
 * @param collection    whether the attribute is a collection of basic values
 * @since 1.0.0
 */
public record FieldHandle(From<?, ?> source, String attributeName, Class<?> javaType, ValueDomain domain, boolean collection) {

    public FieldHandle {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(attributeName, "attributeName cannot be null");
        Objects.requireNonNull(javaType, "javaType cannot be null");
        Objects.requireNonNull(domain, "domain cannot be null");
    }

    /** @return the attribute path on its source */
    public Path<?> path() {
        return source.get(attributeName);
    }
}
