package io.github.cyfko.boolexpr.core.config;

/**
 * Complexity limits applied by the parser for DoS protection.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum number of nested parentheses and {@code not} operators (default: 64)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * DslPolicy policy = DslPolicy.defaults();
 *
 * // Strict (for public APIs with untrusted input)
 * DslPolicy policy = DslPolicy.strict();
 *
 * // Relaxed (for internal trusted systems)
 * DslPolicy policy = DslPolicy.relaxed();
 *
 * // Custom
 * DslPolicy policy = DslPolicy.builder()
 *     .maxExpressionLength(10000)
 *     .maxNestingDepth(32)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violations
 * @param maxExpressionLength maximum character length of expression string
 * @param maxNestingDepth     maximum nesting of groups and negations
 * @since 1.0.0
 */
public record DslPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public DslPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration for balanced protection and usability.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return default configuration
     */
    public static DslPolicy defaults() {
        return new DslPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 64);
    }

    /**
     * Strict configuration for public APIs and untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 16</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static DslPolicy strict() {
        return new DslPolicy(PolicyName.STRICT_POLICY.name(), 1000, 16);
    }

    /**
     * Relaxed configuration for internal trusted systems.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static DslPolicy relaxed() {
        return new DslPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 256);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as if created with the default mode.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 64;

        private Builder() {}

        public DslPolicy build() {
            return new DslPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
