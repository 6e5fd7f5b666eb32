package io.github.cyfko.boolexpr.core.parsing;

import io.github.cyfko.boolexpr.core.ast.Expression;
import io.github.cyfko.boolexpr.core.ast.LogicOp;
import io.github.cyfko.boolexpr.core.config.DslPolicy;
import io.github.cyfko.boolexpr.core.config.GrammarConfig;
import io.github.cyfko.boolexpr.core.exception.DSLSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent over the boolean operators, with clauses as the primaries.
 *
 * <pre>
 * or      := and ("or" and)*
 * and     := not ("and" not)*
 * not     := "not" not | primary
 * primary := "(" or ")" | clause
 * clause  := first matching rule of the grammar
 * </pre>
 *
 * <p>
 * Same-operator runs are collected into one operand list before the combinator is called, so
 * {@code a and b and c} yields a single three-operand node. A failed continuation rewinds the
 * cursor to before the operator keyword, leaving the unmatched text for the trailing input check.
 * </p>
 *
 * <p>A parser instance holds per-call state and is used for exactly one input.</p>
 *
 * @since 1.0.0
 */
public final class PrecedenceParser {

    private final GrammarConfig grammar;
    private final DslPolicy policy;
    private final InputCursor cursor;
    private int depth;

    private PrecedenceParser(GrammarConfig grammar, DslPolicy policy, String input) {
        this.grammar = grammar;
        this.policy = policy;
        this.cursor = new InputCursor(input);
    }

    /**
     * Parses the whole {@code input}.
     *
     * @return the root node
     * @throws DSLSyntaxException if the input is not fully consumed by the grammar, or nests
     *                            deeper than the policy allows
     */
    public static Expression parse(String input, GrammarConfig grammar, DslPolicy policy) {
        return new PrecedenceParser(grammar, policy, input).parseInput();
    }

    private Expression parseInput() {
        Expression root = parseOr();
        cursor.skipWhitespace();
        if (root == null || !cursor.atEnd()) {
            int position = Math.max(cursor.furthestFailure(), cursor.position());
            throw DSLSyntaxException.at(cursor.text(), position);
        }
        return root;
    }

    private Expression parseOr() {
        return parseChain(LogicOp.OR);
    }

    private Expression parseChain(LogicOp op) {
        Expression first = op == LogicOp.OR ? parseChain(LogicOp.AND) : parseNot();
        if (first == null) {
            return null;
        }

        List<Expression> operands = new ArrayList<>();
        operands.add(first);
        while (true) {
            int mark = cursor.position();
            Expression next = null;
            if (Lexicon.keyword(cursor, op.keyword())) {
                next = op == LogicOp.OR ? parseChain(LogicOp.AND) : parseNot();
            }
            if (next == null) {
                cursor.reset(mark);
                break;
            }
            operands.add(next);
        }

        return operands.size() == 1 ? first : grammar.combinators().combine(op, operands);
    }

    private Expression parseNot() {
        int mark = cursor.position();
        if (Lexicon.keyword(cursor, LogicOp.NOT.keyword())) {
            enter();
            Expression operand = parseNot();
            depth--;
            if (operand != null) {
                return grammar.combinators().combine(LogicOp.NOT, List.of(operand));
            }
            cursor.reset(mark);
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        int mark = cursor.position();
        if (cursor.consume('(')) {
            enter();
            Expression inner = parseOr();
            depth--;
            if (inner != null && cursor.consume(')')) {
                return inner;
            }
            cursor.reset(mark);
            return null;
        }

        for (ClauseRule rule : grammar.rules()) {
            var match = rule.grammar().match(cursor);
            if (match.isPresent()) {
                return rule.action().apply(match.get());
            }
        }
        return null;
    }

    private void enter() {
        if (++depth > policy.maxNestingDepth()) {
            throw new DSLSyntaxException(String.format(
                    "Expression nesting too deep (more than %d levels). Policy applied: %s",
                    policy.maxNestingDepth(), policy.policyName()
            ));
        }
    }
}
