package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.exception.ClauseStructureException;
import io.github.cyfko.boolexpr.core.exception.DSLSyntaxException;

/**
 * Framework-agnostic parser turning a boolean condition expression into an AST.
 *
 * <h2>Expression Language</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Keyword</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(x &gt; 5 or y &lt; 3)</td></tr>
 * <tr><td>NOT</td><td>not</td><td>3</td><td>Right</td><td>not z == 2</td></tr>
 * <tr><td>AND</td><td>and</td><td>2</td><td>Left</td><td>x &gt; 5 and y &lt; 3</td></tr>
 * <tr><td>OR</td><td>or</td><td>1</td><td>Left</td><td>x &gt; 5 or y &lt; 3</td></tr>
 * </tbody>
 * </table>
 * <p>Keywords are case-insensitive.</p>
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * expression := term ("or" term)*
 * term       := factor ("and" factor)*
 * factor     := "not" factor | "(" expression ")" | clause
 * clause     := name "between" value "and" value
 *             | name operator value
 *             | name
 * operator   := "==" | "&lt;=" | "&gt;=" | "!=" | "&lt;" | "&gt;" | "=" | "&amp;" | "|"
 * </pre>
 * <p>
 * Which clause shapes are accepted depends on the
 * {@link io.github.cyfko.boolexpr.core.config.GrammarConfig} the parser was built with.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * DslParser parser = new BasicDslParser(GrammarConfig.generic(), DslPolicy.defaults());
 *
 * parser.parse("alpha").repr();                          // alpha
 * parser.parse("a between 3 and 5").repr();              // abetween3and5
 * parser.parse("x > 5 or y < 3 and not z == 2").repr();  // or_(x>5, and_(y<3, not_(z==2)))
 * }</pre>
 *
 * <p>Implementations must be safe for concurrent use once constructed.</p>
 *
 * @see ParsedExpression
 * @see DSLSyntaxException
 * @since 1.0.0
 */
public interface DslParser {

    /**
     * Parses the whole expression.
     *
     * @param expression the text to parse, must not be null or blank
     * @return the parsed expression, owned by the caller
     * @throws DSLSyntaxException       if the text does not match the grammar, if input remains
     *                                  unconsumed, or if a policy limit is exceeded
     * @throws ClauseStructureException if a clause matched but holds invalid data, such as a
     *                                  parameter name with more than one {@code .}
     */
    ParsedExpression parse(String expression) throws DSLSyntaxException;
}
