package io.github.cyfko.boolexpr.core.ast;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BooleanNodeTest {

    private static Condition condition(String parameter, String operator, String value) {
        return new Condition(ParameterName.parse(parameter), operator, value);
    }

    @Test
    void reprJoinsChildren() {
        BooleanNode node = BooleanNode.and(condition("x", ">", "5"), condition("y", "<", "3"));
        assertEquals("and_(x>5, y<3)", node.repr());
    }

    @Test
    void nestedRepr() {
        BooleanNode node = BooleanNode.or(
                condition("x", ">", "5"),
                BooleanNode.and(condition("y", "<", "3"), BooleanNode.not(condition("z", "==", "2"))));
        assertEquals("or_(x>5, and_(y<3, not_(z==2)))", node.repr());
    }

    @Test
    void paramsIsTheUnionOfLeaves() {
        BooleanNode node = BooleanNode.or(
                condition("a", ">", "5"),
                BooleanNode.and(condition("b", "<", "3"), new Word(ParameterName.parse("t.a")), condition("a", "<", "9")));
        assertEquals(Set.of("a", "b", "t.a"), node.params());
    }

    @Test
    void notRequiresExactlyOneOperand() {
        Condition x = condition("x", ">", "5");
        assertThrows(IllegalArgumentException.class, () -> new BooleanNode(LogicOp.NOT, List.of(x, x)));
        assertThrows(IllegalArgumentException.class, () -> new BooleanNode(LogicOp.NOT, List.of()));
    }

    @Test
    void binaryOperatorsRequireTwoOperands() {
        Condition x = condition("x", ">", "5");
        assertThrows(IllegalArgumentException.class, () -> new BooleanNode(LogicOp.AND, List.of(x)));
        assertThrows(IllegalArgumentException.class, () -> new BooleanNode(LogicOp.OR, List.of()));
    }

    @Test
    void childrenAreCopied() {
        java.util.ArrayList<Expression> children = new java.util.ArrayList<>(List.of(condition("x", ">", "5"), condition("y", ">", "5")));
        BooleanNode node = new BooleanNode(LogicOp.AND, children);
        children.clear();
        assertEquals(2, node.conditions().size());
        assertThrows(UnsupportedOperationException.class, () -> node.children().add(condition("z", ">", "1")));
    }

    @Test
    void visitorDispatchesOnVariant() {
        ExpressionVisitor<String> visitor = new ExpressionVisitor<>() {
            @Override
            public String visitWord(Word word) {
                return "word";
            }

            @Override
            public String visitCondition(Condition condition) {
                return "condition";
            }

            @Override
            public String visitBoolean(BooleanNode node) {
                return node.op().keyword();
            }
        };
        assertEquals("word", new Word(ParameterName.parse("a")).accept(visitor));
        assertEquals("condition", condition("a", "=", "1").accept(visitor));
        assertEquals("not", BooleanNode.not(condition("a", "=", "1")).accept(visitor));
    }

    @Test
    void logicOpFromKeywordIgnoresCase() {
        assertEquals(LogicOp.AND, LogicOp.fromKeyword("AND"));
        assertEquals(LogicOp.NOT, LogicOp.fromKeyword("Not"));
        assertThrows(IllegalArgumentException.class, () -> LogicOp.fromKeyword("xor"));
    }
}
