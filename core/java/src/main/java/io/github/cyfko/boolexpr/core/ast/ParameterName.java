package io.github.cyfko.boolexpr.core.ast;

import io.github.cyfko.boolexpr.core.exception.ClauseStructureException;

import java.util.Objects;

/**
 * A parameter reference split into an optional {@code base} (table, entity or alias qualifier)
 * and a leaf {@code name}.
 *
 * <pre>{@code
 * ParameterName.parse("modela.x");   // base = "modela", name = "x"
 * ParameterName.parse("x");          // base = null,     name = "x"
 * ParameterName.parse("a.b.c");      // ClauseStructureException
 * }</pre>
 *
 * @param base qualifier, {@code null} when the reference is not dotted
 * @param name leaf field name, never empty
 * @since 1.0.0
 */
public record ParameterName(String base, String name) {

    public ParameterName {
        if (name == null || name.isEmpty()) {
            throw new ClauseStructureException("parameter name cannot be null or empty");
        }
        if (base != null && base.isEmpty()) {
            base = null;
        }
    }

    /**
     * Splits a dotted identifier on its single {@code .} separator.
     *
     * @param parameter the raw identifier as matched by the grammar
     * @return the parsed name
     * @throws ClauseStructureException if {@code parameter} holds more than one {@code .}
     */
    public static ParameterName parse(String parameter) {
        Objects.requireNonNull(parameter, "parameter cannot be null");

        int dot = parameter.indexOf('.');
        if (dot != parameter.lastIndexOf('.')) {
            throw new ClauseStructureException(String.format("parameter %s cannot have more than one .", parameter));
        }
        if (dot < 0) {
            return new ParameterName(null, parameter);
        }
        return new ParameterName(parameter.substring(0, dot), parameter.substring(dot + 1));
    }

    /** @return {@code base.name}, or {@code name} alone when there is no base */
    public String fullname() {
        return base != null ? base + "." + name : name;
    }

    public boolean hasBase() {
        return base != null;
    }

    @Override
    public String toString() {
        return fullname();
    }
}
