package org.csu.kpiformula.compiler;

import org.csu.kpiformula.compiler.lexer.Lexer;
import org.csu.kpiformula.compiler.parser.Parser;
import org.csu.kpiformula.compiler.semantic.VariableExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class VariableExtractorTest {

    private final VariableExtractor extractor = new VariableExtractor();

    private List<String> extract(String formula) {
        return extractor.extract(new Parser(new Lexer(formula).tokenize()).parse());
    }

    @Test
    void testFirstOccurrenceOrder() {
        assertEquals(List.of("spent", "leads"), extract("spent / leads"));
        assertEquals(List.of("likes", "comments", "shares", "impressions"),
                extract("(likes + comments + shares) / impressions * 100"));
    }

    @Test
    void testDuplicatesCollapse() {
        assertEquals(List.of("a", "b"), extract("a + a + b"));
        assertEquals(List.of("b", "a", "c"), extract("(b + a) * c - a"));
        assertEquals(List.of("x", "y"), extract("-x / (y + -x)"));
    }

    @Test
    void testLiteralOnlyFormula() {
        assertEquals(List.of(), extract("1 + 2 * 3"));
    }
}
