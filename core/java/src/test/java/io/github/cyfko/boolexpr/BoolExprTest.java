package io.github.cyfko.boolexpr;

import io.github.cyfko.boolexpr.core.api.ParserFlavor;
import io.github.cyfko.boolexpr.core.ast.Word;
import io.github.cyfko.boolexpr.core.exception.DSLSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoolExprTest {

    @Test
    void defaultFlavourParsesConditions() {
        assertEquals("and_(x>5, abetween1and2)", BoolExpr.parse("modela.x > 5 and a between 1 and 2").repr());
    }

    @Test
    void defaultFlavourRejectsBareWords() {
        DSLSyntaxException ex = assertThrows(DSLSyntaxException.class, () -> BoolExpr.parse("stuff"));
        assertTrue(ex.getMessage().contains("Parsing syntax error"));
        assertEquals("Parsing syntax error (stuff>!<) at line:1, col:6", ex.getMessage());
    }

    @Test
    void genericFlavourAcceptsBareWords() {
        assertInstanceOf(Word.class, BoolExpr.parse("stuff", ParserFlavor.GENERIC).root());
        assertEquals("or_(and_(alpha, beta), not_(charlie))",
                BoolExpr.parse("alpha and beta or not charlie", ParserFlavor.GENERIC).repr());
    }

    @Test
    void parsersAreShared() {
        assertSame(BoolExpr.parser(ParserFlavor.CRITERIA), BoolExpr.parser(ParserFlavor.CRITERIA));
        assertNotSame(BoolExpr.parser(ParserFlavor.CRITERIA), BoolExpr.parser(ParserFlavor.GENERIC));
    }

    @Test
    void concurrentParsesDoNotInterfere() throws InterruptedException {
        String[] inputs = {"x > 1 and y < 2", "a between 1 and 9 or b == 3", "not z != 4"};
        String[] expected = {"and_(x>1, y<2)", "or_(abetween1and9, b==3)", "not_(z!=4)"};
        Thread[] threads = new Thread[6];
        AtomicInteger failures = new AtomicInteger();

        for (int t = 0; t < threads.length; t++) {
            int index = t % inputs.length;
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 500; i++) {
                    if (!expected[index].equals(BoolExpr.parse(inputs[index]).repr())) {
                        failures.incrementAndGet();
                    }
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        assertEquals(0, failures.get());
    }
}
