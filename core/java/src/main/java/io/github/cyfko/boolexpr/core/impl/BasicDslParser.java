package io.github.cyfko.boolexpr.core.impl;

import io.github.cyfko.boolexpr.core.api.DslParser;
import io.github.cyfko.boolexpr.core.api.ParsedExpression;
import io.github.cyfko.boolexpr.core.ast.Expression;
import io.github.cyfko.boolexpr.core.config.DslPolicy;
import io.github.cyfko.boolexpr.core.config.GrammarConfig;
import io.github.cyfko.boolexpr.core.exception.DSLSyntaxException;
import io.github.cyfko.boolexpr.core.parsing.PrecedenceParser;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link DslParser}: a precedence parser over the clause rules of a
 * {@link GrammarConfig}.
 * <p>
 * The parser supports the following boolean operators:
 * <ul>
 *   <li>not - precedence: 3, associativity: right</li>
 *   <li>and - precedence: 2, associativity: left</li>
 *   <li>or - precedence: 1, associativity: left</li>
 * </ul>
 * as well as parentheses for managing priorities.
 *
 * <h2>DoS Protection (Complexity Limits)</h2>
 * <p>
 * The parser enforces the limits of its {@link DslPolicy}:
 * </p>
 * <ul>
 *   <li><strong>Expression Length</strong>: Rejects expressions exceeding the configured character size</li>
 *   <li><strong>Nesting Depth</strong>: Rejects expressions nesting groups and negations too deeply</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Configuration is fixed at construction; every call to {@link #parse(String)} works on its own
 * cursor, so one instance can serve concurrent callers.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Generic grammar, default limits
 * DslParser parser = new BasicDslParser();
 * ParsedExpression expr = parser.parse("alpha and beta or not charlie");
 *
 * // Query grammar, strict limits (for public APIs)
 * DslParser strictParser = new BasicDslParser(GrammarConfig.criteria(), DslPolicy.strict());
 * ParsedExpression expr = strictParser.parse("modela.x > 5 and modela.name = foo*");
 * }</pre>
 *
 * @since 1.0.0
 */
public class BasicDslParser implements DslParser {

    private static final Logger logger = Logger.getLogger(BasicDslParser.class.getName());

    private final GrammarConfig grammar;
    private final DslPolicy dslPolicy;

    /**
     * Default constructor using {@link GrammarConfig#generic()} and {@link DslPolicy#defaults()}.
     */
    public BasicDslParser() {
        this(GrammarConfig.generic(), DslPolicy.defaults());
    }

    /**
     * Constructor with a custom grammar and default limits.
     *
     * @param grammar the clause rules and combinators
     * @throws IllegalArgumentException if grammar is null
     */
    public BasicDslParser(GrammarConfig grammar) {
        this(grammar, DslPolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param grammar   the clause rules and combinators
     * @param dslPolicy the parser configuration with complexity limits
     * @throws IllegalArgumentException if any argument is null
     */
    public BasicDslParser(GrammarConfig grammar, DslPolicy dslPolicy) {
        if (grammar == null) {
            throw new IllegalArgumentException("Grammar configuration is required");
        }
        if (dslPolicy == null) {
            throw new IllegalArgumentException("DSL policy is required");
        }
        this.grammar = grammar;
        this.dslPolicy = dslPolicy;
    }

    public GrammarConfig getGrammar() {
        return grammar;
    }

    public DslPolicy getDslPolicy() {
        return dslPolicy;
    }

    /**
     * Parses the given expression.
     *
     * @param dslExpression the expression to parse
     * @return the parsed expression
     * @throws DSLSyntaxException if the expression is {@code null} or {@code empty}, contains syntax
     *                            errors or exceeds limits
     */
    @Override
    public ParsedExpression parse(String dslExpression) throws DSLSyntaxException {
        if (dslExpression == null || dslExpression.isBlank()) {
            throw new DSLSyntaxException("DSL expression cannot be null or empty");
        }

        // DoS protection
        if (dslExpression.length() > dslPolicy.maxExpressionLength()) {
            throw new DSLSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    dslExpression.length(), dslPolicy.maxExpressionLength(), dslPolicy.policyName()
            ));
        }

        try {
            Expression root = PrecedenceParser.parse(dslExpression, grammar, dslPolicy);
            return new ParsedExpression(dslExpression, root);
        } catch (DSLSyntaxException e) {
            logger.log(Level.FINE, () -> "Rejected expression with " + grammar + ": " + e.getMessage());
            throw e;
        }
    }
}
