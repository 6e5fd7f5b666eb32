package io.github.cyfko.boolexpr.core.exception;

import java.util.List;

/**
 * Exception thrown during lowering when none of the candidate sources exposes the field a
 * condition refers to.
 *
 * <pre>{@code
 * // → "Field 'missingfield' not found in any of the sources [ModelA (modela)]"
 * }</pre>
 *
 * @since 1.0.0
 */
public class FieldNotFoundException extends BoolExprException {

    private final String field;
    private final List<String> triedSources;

    /**
     * @param field        full name of the field that could not be resolved
     * @param triedSources descriptions of every source that was tried, in order
     */
    public FieldNotFoundException(String field, List<String> triedSources) {
        super(String.format("Field '%s' not found in any of the sources %s", field, triedSources));
        this.field = field;
        this.triedSources = List.copyOf(triedSources);
    }

    public String getField() {
        return field;
    }

    public List<String> getTriedSources() {
        return triedSources;
    }
}
