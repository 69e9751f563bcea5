package com.excelgrid.app.formula;

import com.excelgrid.app.exceptions.FormulaSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    void testTokenizeMixedExpression() {
        List<Token> tokens = tokenizer.tokenize("(A1 + 2.5) * BC12/4");
        assertEquals(List.of(
                Token.LEFT_PAREN,
                Token.cellRef("A1"),
                Token.operator('+'),
                Token.number(2.5),
                Token.RIGHT_PAREN,
                Token.operator('*'),
                Token.cellRef("BC12"),
                Token.operator('/'),
                Token.number(4)
        ), tokens);
    }

    @Test
    void testWhitespaceIsSkipped() {
        assertEquals(List.of(Token.number(1), Token.operator('-'), Token.number(2)),
                tokenizer.tokenize("  1 -\t2  "));
        assertTrue(tokenizer.tokenize("   ").isEmpty());
    }

    @Test
    void testUnexpectedCharacterFails() {
        FormulaSyntaxException ex = assertThrows(FormulaSyntaxException.class,
                () -> tokenizer.tokenize("1 + $A1"));
        assertTrue(ex.getMessage().contains("'$'"));
        assertThrows(FormulaSyntaxException.class, () -> tokenizer.tokenize("a1"));
        assertThrows(FormulaSyntaxException.class, () -> tokenizer.tokenize("2^3"));
    }

    @Test
    void testLettersWithoutRowFail() {
        assertThrows(FormulaSyntaxException.class, () -> tokenizer.tokenize("SUM(A1)"));
    }

    @Test
    void testMalformedNumberFails() {
        assertThrows(FormulaSyntaxException.class, () -> tokenizer.tokenize("1.2.3"));
    }

    /**
     * Tokens before a bad character are still produced when iterating lazily.
     */
    @Test
    void testLazyTokensStopAtError() {
        Iterator<Token> tokens = tokenizer.tokens("7 # 8").iterator();
        assertTrue(tokens.hasNext());
        assertEquals(Token.number(7), tokens.next());
        assertThrows(FormulaSyntaxException.class, tokens::next);
    }
}
