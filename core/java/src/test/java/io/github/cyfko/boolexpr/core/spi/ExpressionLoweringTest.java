package io.github.cyfko.boolexpr.core.spi;

import io.github.cyfko.boolexpr.BoolExpr;
import io.github.cyfko.boolexpr.core.api.ParserFlavor;
import io.github.cyfko.boolexpr.core.ast.Condition;
import io.github.cyfko.boolexpr.core.ast.Expression;
import io.github.cyfko.boolexpr.core.ast.LogicOp;
import io.github.cyfko.boolexpr.core.ast.ParameterName;
import io.github.cyfko.boolexpr.core.ast.Word;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpressionLoweringTest {

    /** Renders to a SQL-like string, resolving names through a field resolver. */
    static final class SqlText implements ExpressionLowering<String, List<String>> {

        private final FieldResolver<String, String> resolver;

        SqlText(FieldResolver<String, String> resolver) {
            this.resolver = resolver;
        }

        private String column(ParameterName parameter, List<String> tables) {
            for (String table : tables) {
                Optional<String> column = resolver.resolve(parameter, table);
                if (column.isPresent()) return column.get();
            }
            throw new IllegalStateException("no " + parameter);
        }

        @Override
        public String lowerCondition(Condition condition, List<String> tables) {
            return column(condition.parameter(), tables) + " " + condition.operator() + " " + condition.value();
        }

        @Override
        public String lowerWord(Word word, List<String> tables) {
            return column(word.parameter(), tables) + " IS TRUE";
        }

        @Override
        public String combine(LogicOp op, List<String> operands, List<String> tables) {
            if (op == LogicOp.NOT) return "NOT (" + operands.get(0) + ")";
            return "(" + String.join(" " + op.name() + " ", operands) + ")";
        }
    }

    @Mock
    private FieldResolver<String, String> resolver;

    @Test
    void walksTheTreeBottomUp() {
        when(resolver.resolve(any(), any())).thenAnswer(inv -> {
            ParameterName p = inv.getArgument(0);
            return Optional.of(inv.getArgument(1) + "." + p.name());
        });

        Expression root = BoolExpr.parse("x > 5 or y < 3 and not z == 2").root();
        assertEquals("(t.x > 5 OR (t.y < 3 AND NOT (t.z == 2)))", new SqlText(resolver).lower(root, List.of("t")));
    }

    @Test
    void wordsAreLoweredThroughLowerWord() {
        when(resolver.resolve(any(), any())).thenReturn(Optional.of("active"));

        Expression root = BoolExpr.parse("not alpha", ParserFlavor.GENERIC).root();
        assertEquals("NOT (active IS TRUE)", new SqlText(resolver).lower(root, List.of("t")));
    }

    @Test
    void failureAbortsTheWholeWalk() {
        when(resolver.resolve(any(), any())).thenReturn(Optional.empty());
        SqlText lowering = spy(new SqlText(resolver));

        Expression root = BoolExpr.parse("x > 5 and y < 3").root();
        assertThrows(IllegalStateException.class, () -> lowering.lower(root, List.of("a", "b")));
        verify(lowering, never()).combine(any(), any(), any());
        verify(resolver, times(2)).resolve(any(), any());
    }
}
