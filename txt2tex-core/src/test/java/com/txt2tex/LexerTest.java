package com.txt2tex;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.txt2tex.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return Lexer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testLongestOperatorWins() {
        assertEquals(List.of(IDENTIFIER, PFUN, IDENTIFIER, EOF), types("X +-> Y"));
        assertEquals(List.of(IDENTIFIER, FINFUN, IDENTIFIER, EOF), types("X 77-> Y"));
        assertEquals(List.of(IDENTIFIER, BIJECTION, IDENTIFIER, EOF), types("X >->> Y"));
        assertEquals(List.of(IDENTIFIER, NDRES, IDENTIFIER, EOF), types("S <<| R"));
        assertEquals(List.of(IDENTIFIER, FREE_TYPE, IDENTIFIER, EOF), types("T ::= a"));
    }

    @Test
    void testAngleBracketsVersusComparison() {
        assertEquals(List.of(LANGLE, RANGLE, EOF), types("<>"));
        assertEquals(List.of(LANGLE, IDENTIFIER, RANGLE, EOF), types("<x>"));
        assertEquals(List.of(LANGLE, IDENTIFIER, COMMA, IDENTIFIER, RANGLE, EOF), types("<a, b>"));
        assertEquals(List.of(IDENTIFIER, GREATER_THAN, IDENTIFIER, EOF), types("x > y"));
        assertEquals(List.of(IDENTIFIER, LESS_THAN, IDENTIFIER, EOF), types("x < y"));
        assertEquals(List.of(IDENTIFIER, GREATER_EQUAL, IDENTIFIER, EOF), types("x >= y"));
        assertEquals(List.of(IDENTIFIER, RELATION, IDENTIFIER, EOF), types("a <-> b"));
    }

    @Test
    void testUnspacedGreaterThanOutsideSequence() {
        assertEquals(List.of(IDENTIFIER, GREATER_THAN, IDENTIFIER, EOF), types("a>b"));
        assertEquals(List.of(LANGLE, IDENTIFIER, RANGLE, GREATER_THAN, IDENTIFIER, EOF), types("<a>>b"));
    }

    @Test
    void testTokenListIsImmutable() {
        Lexer lexer = new Lexer("x = 1");
        List<Token> first = lexer.tokenize();
        assertThrows(UnsupportedOperationException.class, () -> first.add(first.get(0)));
        assertEquals(first, lexer.tokenize());
        assertEquals(4, lexer.tokenize().size());
    }

    @Test
    void testCaretDependsOnPrecedingSpace() {
        assertEquals(List.of(IDENTIFIER, CARET, NUMBER, EOF), types("x^2"));
        assertEquals(List.of(LANGLE, IDENTIFIER, RANGLE, CAT, IDENTIFIER, EOF), types("<x> ^ s"));
    }

    @Test
    void testUnspacedSequenceConcatenationIsRejected() {
        LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("<x>^<y>"));
        assertTrue(e.getRawMessage().contains("concatenation needs spaces"));
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
    }

    @Test
    void testPartLabelOnlyAtLineStart() {
        List<Token> tokens = Lexer.tokenize("(a) p land q");
        assertEquals(PART_LABEL, tokens.get(0).type());
        assertEquals("(a)", tokens.get(0).lexeme());

        assertEquals(PART_LABEL, types("(iv) x").get(0));
        assertEquals(PART_LABEL, types("(b)\nx").get(0));
        assertEquals(LPAREN, types("(b)").get(0));
        assertEquals(LPAREN, types("(x) + 1").get(0));
        assertEquals(LPAREN, types("(a)+1").get(0));
        assertEquals(List.of(IDENTIFIER, EQUALS, LPAREN, IDENTIFIER, RPAREN, EOF), types("y = (a) "));
    }

    @Test
    void testDigitLedIdentifier() {
        List<Token> tokens = Lexer.tokenize("479_courses");
        assertEquals(IDENTIFIER, tokens.get(0).type());
        assertEquals("479_courses", tokens.get(0).lexeme());
        assertEquals(List.of(NUMBER, EOF), types("479"));
    }

    @Test
    void testBackslashIsContinuationOrSetMinus() {
        assertEquals(List.of(IDENTIFIER, SETMINUS, IDENTIFIER, EOF), types("A \\ B"));
        assertEquals(List.of(IDENTIFIER, LAND, CONTINUATION, IDENTIFIER, EOF), types("p land \\  \nq"));
    }

    @Test
    void testTruthTableKeywordBacktracks() {
        assertEquals(TRUTH_TABLE, types("TRUTH TABLE:").get(0));
        List<Token> tokens = Lexer.tokenize("TRUTH = x");
        assertEquals(IDENTIFIER, tokens.get(0).type());
        assertEquals("TRUTH", tokens.get(0).lexeme());
        assertEquals(EQUALS, tokens.get(1).type());
    }

    @Test
    void testColonKeywords() {
        Token text = Lexer.tokenize("TEXT:   Hello, world  ").get(0);
        assertEquals(TEXT, text.type());
        assertEquals("Hello, world", text.lexeme());

        Token argue = Lexer.tokenize("ARGUE:").get(0);
        Token equiv = Lexer.tokenize("EQUIV:").get(0);
        assertEquals(ARGUE, argue.type());
        assertEquals(ARGUE, equiv.type());
        assertEquals("EQUIV:", equiv.lexeme());

        assertEquals(List.of(PROOF, EOF), types("PROOF:"));
        assertEquals(List.of(IDENTIFIER, EOF), types("PROOF"));
    }

    @Test
    void testProseLineIsCapturedWhole() {
        List<Token> tokens = Lexer.tokenize("The value is finite.");
        assertEquals(2, tokens.size());
        assertEquals(TEXT, tokens.get(0).type());
        assertEquals("The value is finite.", tokens.get(0).lexeme());
    }

    @Test
    void testSentenceStarterFollowedByKeywordIsNotProse() {
        assertEquals(List.of(IDENTIFIER, UNION, IDENTIFIER, EOF), types("A union B"));
        assertEquals(List.of(IDENTIFIER, EQUALS, LBRACE, NUMBER, RBRACE, EOF), types("A = {1}"));
    }

    @Test
    void testProseIsNotCapturedInsideSolutionMarker() {
        List<TokenType> types = types("** Solution 1\nThe answer **");
        assertEquals(List.of(SOLUTION_MARKER, IDENTIFIER, NUMBER, NEWLINE, IDENTIFIER, IDENTIFIER,
                SOLUTION_MARKER, EOF), types);
    }

    @Test
    void testUnicodeAliases() {
        assertEquals(List.of(IDENTIFIER, LAND, IDENTIFIER, EOF), types("p ∧ q"));
        assertEquals(List.of(LANGLE, IDENTIFIER, RANGLE, CAT, LANGLE, IDENTIFIER, RANGLE, EOF), types("⟨a⟩ ⌢ ⟨b⟩"));
        assertEquals(List.of(IDENTIFIER, CROSS, IDENTIFIER, EOF), types("A × B"));
    }

    @Test
    void testKeywordAliases() {
        assertEquals(List.of(IDENTIFIER, LAND, IDENTIFIER, LOR, IDENTIFIER, EOF), types("p and q or r"));
        assertEquals(List.of(IDENTIFIER, ELEM, IDENTIFIER, EOF), types("x in S"));
        assertEquals(List.of(IDENTIFIER, NOT_EQUAL, IDENTIFIER, EOF), types("x /= y"));
    }

    @Test
    void testDecorationsAndSubscripts() {
        List<Token> tokens = Lexer.tokenize("x' = x + 1");
        assertEquals("x'", tokens.get(0).lexeme());
        assertEquals(IDENTIFIER, tokens.get(0).type());

        assertEquals(IDENTIFIER, Lexer.tokenize("in?").get(0).type());
        assertEquals(List.of(IDENTIFIER, UNDERSCORE, IDENTIFIER, EOF), types("x_i"));
        assertEquals(List.of(IDENTIFIER, EOF), types("max_size"));
    }

    @Test
    void testBagClosesOnlyInsideBag() {
        assertEquals(List.of(LBAG, IDENTIFIER, RBAG, EOF), types("[[a]]"));
        assertEquals(List.of(IDENTIFIER, LBRACKET, IDENTIFIER, LBRACKET, IDENTIFIER, RBRACKET, RBRACKET, EOF),
                types("f[g[x]]"));
    }

    @Test
    void testNewlinesInsideBracketsAreDropped() {
        assertEquals(List.of(LPAREN, IDENTIFIER, COMMA, IDENTIFIER, RPAREN, EOF), types("(a,\n b)"));
        assertEquals(List.of(IDENTIFIER, NEWLINE, IDENTIFIER, EOF), types("a\nb"));
    }

    @Test
    void testPositionsAreOneBased() {
        List<Token> tokens = Lexer.tokenize("x\n  y");
        Token y = tokens.get(2);
        assertEquals("y", y.lexeme());
        assertEquals(2, y.line());
        assertEquals(3, y.column());
    }

    @Test
    void testUnknownCharacter() {
        LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("x @ y"));
        assertEquals("Unexpected character '@'", e.getRawMessage());
        assertEquals(1, e.getLine());
        assertEquals(3, e.getColumn());
        assertEquals("Line 1, column 3: Unexpected character '@'", e.getMessage());
    }
}
