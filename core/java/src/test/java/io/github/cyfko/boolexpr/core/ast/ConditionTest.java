package io.github.cyfko.boolexpr.core.ast;

import io.github.cyfko.boolexpr.core.exception.ClauseStructureException;
import io.github.cyfko.boolexpr.core.parsing.ClauseMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Condition")
class ConditionTest {

    @Nested
    @DisplayName("Construction from clause matches")
    class FromMatch {

        @Test
        void binaryCondition() {
            Condition condition = Condition.fromMatch(ClauseMatch.condition("modela.x", ">", "5"));
            assertEquals("modela.x", condition.fullname());
            assertEquals("x", condition.name());
            assertEquals("modela", condition.base());
            assertEquals(">", condition.operator());
            assertEquals("5", condition.value());
            assertNull(condition.value2());
            assertFalse(condition.isBetween());
        }

        @Test
        void betweenUsesBothBounds() {
            Condition condition = Condition.fromMatch(ClauseMatch.between("a", "3", "5"));
            assertEquals("between", condition.operator());
            assertEquals("3", condition.value());
            assertEquals("5", condition.value2());
            assertTrue(condition.isBetween());
        }

        @Test
        void malformedParameterFails() {
            assertThrows(ClauseStructureException.class,
                    () -> Condition.fromMatch(ClauseMatch.condition("a.b.c", ">", "5")));
        }
    }

    @Nested
    @DisplayName("Bitwise negation")
    class BitwiseNegation {

        @ParameterizedTest(name = "{0} {1} -> {2}")
        @CsvSource({
                "&, ~64, -65",
                "|, ~0, -1",
                "&, 64, 64",
                "=, ~64, 64",
                "==, ~7, 7",
                ">, ~1, 1"
        })
        void normalizesOnlyUnderBitwiseOperators(String operator, String literal, String expected) {
            Condition condition = Condition.fromMatch(ClauseMatch.condition("flags", operator, literal));
            assertEquals(expected, condition.value());
        }

        @Test
        void betweenBoundsAreStrippedToo() {
            Condition condition = Condition.fromMatch(ClauseMatch.between("x", "~1", "~9"));
            assertEquals("1", condition.value());
            assertEquals("9", condition.value2());
        }

        @Test
        void nonIntegerBitwiseOperandFails() {
            assertThrows(ClauseStructureException.class,
                    () -> Condition.fromMatch(ClauseMatch.condition("flags", "&", "~abc")));
        }
    }

    @Test
    @DisplayName("repr drops spaces and the base")
    void repr() {
        assertEquals("x>5", new Condition(ParameterName.parse("modela.x"), ">", "5").repr());
        assertEquals("abetween3and5", new Condition(ParameterName.parse("a"), "between", "3", "5").repr());
    }

    @Test
    void inputClauseKeepsSpacesAndBase() {
        assertEquals("modela.x > 5", new Condition(ParameterName.parse("modela.x"), ">", "5").inputClause());
        assertEquals("a between 3 and 5", new Condition(ParameterName.parse("a"), "between", "3", "5").inputClause());
    }

    @Test
    void secondValueOnlyForBetween() {
        ParameterName a = ParameterName.parse("a");
        assertThrows(ClauseStructureException.class, () -> new Condition(a, "between", "3", null));
        assertThrows(ClauseStructureException.class, () -> new Condition(a, ">", "3", "5"));
    }

    @Test
    void unknownOperatorIsRejected() {
        assertThrows(ClauseStructureException.class, () -> new Condition(ParameterName.parse("a"), "<>", "3"));
    }

    @Test
    void nullLiteralIgnoresCase() {
        assertTrue(new Condition(ParameterName.parse("a"), "=", "NULL").isNullLiteral());
        assertFalse(new Condition(ParameterName.parse("a"), "=", "nullable").isNullLiteral());
    }

    @Test
    void paramsHoldsTheFullname() {
        assertEquals(Set.of("modela.x"), new Condition(ParameterName.parse("modela.x"), "<", "1").params());
    }
}
