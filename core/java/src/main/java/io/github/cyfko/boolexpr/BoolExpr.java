package io.github.cyfko.boolexpr;

import io.github.cyfko.boolexpr.core.api.DslParser;
import io.github.cyfko.boolexpr.core.api.ParsedExpression;
import io.github.cyfko.boolexpr.core.api.ParserFlavor;
import io.github.cyfko.boolexpr.core.config.DslPolicy;
import io.github.cyfko.boolexpr.core.impl.BasicDslParser;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for one-off parsing with the preconfigured grammars.
 *
 * <pre>{@code
 * ParsedExpression expr = BoolExpr.parse("modela.x > 5 and modela.name = foo");
 * ParsedExpression words = BoolExpr.parse("alpha and not beta", ParserFlavor.GENERIC);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class BoolExpr {

    private static final Map<ParserFlavor, DslParser> PARSERS = new EnumMap<>(ParserFlavor.class);

    static {
        for (ParserFlavor flavor : ParserFlavor.values()) {
            PARSERS.put(flavor, new BasicDslParser(flavor.grammar(), DslPolicy.defaults()));
        }
    }

    private BoolExpr() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Parses with the {@link ParserFlavor#CRITERIA} grammar, which rejects bare words.
     */
    public static ParsedExpression parse(String expression) {
        return parse(expression, ParserFlavor.CRITERIA);
    }

    public static ParsedExpression parse(String expression, ParserFlavor flavor) {
        return parser(flavor).parse(expression);
    }

    /** @return the shared parser of the given flavour */
    public static DslParser parser(ParserFlavor flavor) {
        return PARSERS.get(Objects.requireNonNull(flavor, "flavor cannot be null"));
    }
}
