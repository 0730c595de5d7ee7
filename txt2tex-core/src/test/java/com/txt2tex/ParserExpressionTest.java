package com.txt2tex;

import com.txt2tex.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserExpressionTest {

    private static Expr expr(String source) {
        return Parser.parseExpression(source);
    }

    private static BinaryOp binary(String source) {
        return assertInstanceOf(BinaryOp.class, expr(source));
    }

    private static void assertIdentifier(String name, Expr expr) {
        assertEquals(name, assertInstanceOf(Identifier.class, expr).name());
    }

    // ========================================================================
    // Precedence and associativity
    // ========================================================================

    @Test
    void testTighterOperatorGroupsFirst() {
        BinaryOp or = binary("a land b lor c");
        assertEquals("lor", or.operator());
        BinaryOp and = assertInstanceOf(BinaryOp.class, or.left());
        assertEquals("land", and.operator());
        assertIdentifier("c", or.right());

        assertNotEquals(expr("a land (b lor c)"), or);
    }

    @Test
    void testImplicationIsRightAssociative() {
        BinaryOp outer = binary("p => q => r");
        assertIdentifier("p", outer.left());
        assertEquals("=>", assertInstanceOf(BinaryOp.class, outer.right()).operator());
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        BinaryOp outer = binary("a - b - c");
        assertEquals("-", assertInstanceOf(BinaryOp.class, outer.left()).operator());
        assertIdentifier("c", outer.right());
    }

    @Test
    void testEquivalenceIsLoosestLogicalOperator() {
        BinaryOp iff = binary("p <=> q => r");
        assertEquals("<=>", iff.operator());
        assertEquals("=>", assertInstanceOf(BinaryOp.class, iff.right()).operator());
    }

    @Test
    void testMembershipBindsLooserThanUnion() {
        BinaryOp elem = binary("x elem A union B");
        assertEquals("elem", elem.operator());
        assertEquals("union", assertInstanceOf(BinaryOp.class, elem.right()).operator());
    }

    @Test
    void testExplicitParenthesesAreRecorded() {
        BinaryOp times = binary("(a + b) * c");
        assertTrue(assertInstanceOf(BinaryOp.class, times.left()).explicitParens());

        BinaryOp plus = binary("a + b * c");
        assertFalse(assertInstanceOf(BinaryOp.class, plus.right()).explicitParens());
    }

    @Test
    void testLineBreakAfterOperator() {
        BinaryOp and = binary("p land \\\n q");
        assertTrue(and.lineBreakAfter());
        assertIdentifier("q", and.right());
    }

    // ========================================================================
    // Postfix, superscript and sequences
    // ========================================================================

    @Test
    void testPlusIsInfixWhenAnOperandFollows() {
        BinaryOp plus = binary("R+S");
        assertEquals("+", plus.operator());
        assertIdentifier("R", plus.left());
        assertIdentifier("S", plus.right());
    }

    @Test
    void testPlusIsPostfixAtEndOfInput() {
        UnaryOp closure = assertInstanceOf(UnaryOp.class, expr("R+"));
        assertEquals("+", closure.operator());
        assertIdentifier("R", closure.operand());
    }

    @Test
    void testClosureOfComposition() {
        UnaryOp closure = assertInstanceOf(UnaryOp.class, expr("(R o9 S)+"));
        assertEquals("+", closure.operator());
        BinaryOp composition = assertInstanceOf(BinaryOp.class, closure.operand());
        assertEquals("o9", composition.operator());
        assertIdentifier("R", composition.left());
        assertIdentifier("S", composition.right());
    }

    @Test
    void testInverseAndReflexiveClosure() {
        assertEquals("~", assertInstanceOf(UnaryOp.class, expr("R~")).operator());
        UnaryOp star = assertInstanceOf(UnaryOp.class, binary("R* = S").left());
        assertEquals("*", star.operator());
    }

    @Test
    void testSuperscriptVersusConcatenation() {
        Superscript power = assertInstanceOf(Superscript.class, expr("x^2"));
        assertIdentifier("x", power.base());
        assertEquals("2", assertInstanceOf(NumberLiteral.class, power.exponent()).value());

        BinaryOp cat = binary("<x> ^ s");
        assertEquals("^", cat.operator());
        SequenceLiteral seq = assertInstanceOf(SequenceLiteral.class, cat.left());
        assertEquals(1, seq.elements().size());
        assertIdentifier("s", cat.right());
    }

    @Test
    void testSequenceLiterals() {
        assertTrue(assertInstanceOf(SequenceLiteral.class, expr("<>")).elements().isEmpty());
        assertEquals(1, assertInstanceOf(SequenceLiteral.class, expr("<x>")).elements().size());
        assertEquals(2, assertInstanceOf(SequenceLiteral.class, expr("<a, b>")).elements().size());
        assertEquals(List.of(), assertInstanceOf(BagLiteral.class, expr("[[ ]]")).elements());
    }

    @Test
    void testComparisonsAreNeverSequences() {
        assertEquals(">", binary("x > y").operator());
        assertEquals(">=", binary("x >= y").operator());
        assertEquals("<->", binary("a <-> b").operator());
        assertEquals("<", binary("x < y").operator());
    }

    @Test
    void testUnicodeConcatenation() {
        BinaryOp cat = binary("⟨a⟩ ⌢ ⟨b⟩");
        assertEquals("^", cat.operator());
        assertInstanceOf(SequenceLiteral.class, cat.right());
    }

    @Test
    void testSubscript() {
        Subscript sub = assertInstanceOf(Subscript.class, expr("x_i"));
        assertIdentifier("x", sub.base());
        assertIdentifier("i", sub.index());
    }

    // ========================================================================
    // Binders
    // ========================================================================

    @Test
    void testUniversalQuantifier() {
        Quantifier q = assertInstanceOf(Quantifier.class, expr("forall x : N | x > 0"));
        assertEquals("forall", q.kind());
        assertEquals(List.of("x"), q.variables());
        assertIdentifier("N", q.domain());
        BinaryOp body = assertInstanceOf(BinaryOp.class, q.body());
        assertEquals(">", body.operator());
        assertIdentifier("x", body.left());
        assertEquals("0", assertInstanceOf(NumberLiteral.class, body.right()).value());
        assertNull(q.expression());
        assertNull(q.tuplePattern());
    }

    @Test
    void testMuWithValue() {
        Quantifier mu = assertInstanceOf(Quantifier.class, expr("mu x : N | x > 0 . x * x"));
        assertEquals("mu", mu.kind());
        assertEquals(">", assertInstanceOf(BinaryOp.class, mu.body()).operator());
        BinaryOp value = assertInstanceOf(BinaryOp.class, mu.expression());
        assertEquals("*", value.operator());
    }

    @Test
    void testBulletSeparator() {
        Quantifier q = assertInstanceOf(Quantifier.class, expr("exists x, y : N . x < y"));
        assertEquals("exists", q.kind());
        assertEquals(List.of("x", "y"), q.variables());
        assertEquals("<", assertInstanceOf(BinaryOp.class, q.body()).operator());
    }

    @Test
    void testSemicolonBindingsNest() {
        Quantifier outer = assertInstanceOf(Quantifier.class, expr("forall x : N; y : Z | x = y"));
        assertEquals(List.of("x"), outer.variables());
        Quantifier inner = assertInstanceOf(Quantifier.class, outer.body());
        assertEquals("forall", inner.kind());
        assertEquals(List.of("y"), inner.variables());
        assertIdentifier("Z", inner.domain());
        assertEquals("=", assertInstanceOf(BinaryOp.class, inner.body()).operator());
    }

    @Test
    void testSecondPipeIsConjoined() {
        Quantifier q = assertInstanceOf(Quantifier.class, expr("forall x : N | x > 0 | x < 10"));
        BinaryOp body = assertInstanceOf(BinaryOp.class, q.body());
        assertEquals("land", body.operator());
        assertEquals(">", assertInstanceOf(BinaryOp.class, body.left()).operator());
        assertEquals("<", assertInstanceOf(BinaryOp.class, body.right()).operator());
    }

    @Test
    void testTuplePatternBinding() {
        Quantifier q = assertInstanceOf(Quantifier.class, expr("forall (x, y) : A cross B | x = y"));
        assertEquals(List.of("x", "y"), q.variables());
        assertEquals(2, q.tuplePattern().elements().size());
        assertEquals("cross", assertInstanceOf(BinaryOp.class, q.domain()).operator());
    }

    @Test
    void testFunctionTypedDomain() {
        Quantifier q = assertInstanceOf(Quantifier.class, expr("forall f : X -> Y | f = f"));
        FunctionType type = assertInstanceOf(FunctionType.class, q.domain());
        assertEquals("->", type.arrow());
    }

    @Test
    void testLambda() {
        Lambda lambda = assertInstanceOf(Lambda.class, expr("lambda x : N . x * x"));
        assertEquals(List.of("x"), lambda.variables());
        assertIdentifier("N", lambda.domain());
        assertEquals("*", assertInstanceOf(BinaryOp.class, lambda.body()).operator());
    }

    @Test
    void testLambdaRequiresDomain() {
        ParseException e = assertThrows(ParseException.class, () -> expr("lambda x . x"));
        assertTrue(e.getRawMessage().startsWith("Expected ':' and a domain after lambda variables"));
    }

    @Test
    void testConditional() {
        Conditional cond = assertInstanceOf(Conditional.class, expr("if x > 0 then x else -x"));
        assertEquals(">", assertInstanceOf(BinaryOp.class, cond.condition()).operator());
        assertIdentifier("x", cond.thenExpr());
        assertEquals("-", assertInstanceOf(UnaryOp.class, cond.elseExpr()).operator());
    }

    @Test
    void testGuardedCases() {
        BinaryOp definition = binary("f(x) = a if x > 0\nb if x <= 0");
        assertInstanceOf(FunctionApp.class, definition.left());
        GuardedCases cases = assertInstanceOf(GuardedCases.class, definition.right());
        assertEquals(2, cases.branches().size());
        assertIdentifier("a", cases.branches().get(0).expression());
        assertIdentifier("b", cases.branches().get(1).expression());
        assertEquals("<=", assertInstanceOf(BinaryOp.class, cases.branches().get(1).guard()).operator());
    }

    // ========================================================================
    // Application and projection
    // ========================================================================

    @Test
    void testJuxtapositionIsLeftAssociative() {
        FunctionApp outer = assertInstanceOf(FunctionApp.class, expr("f x y"));
        assertIdentifier("y", outer.args().get(0));
        FunctionApp inner = assertInstanceOf(FunctionApp.class, outer.function());
        assertIdentifier("f", inner.function());
        assertIdentifier("x", inner.args().get(0));
    }

    @Test
    void testProseIsNotApplication() {
        ParseResult result = Parser.parse("The value is finite.");
        Document document = assertInstanceOf(Document.class, result);
        Paragraph paragraph = assertInstanceOf(Paragraph.class, document.items().get(0));
        assertEquals("The value is finite.", paragraph.text());
    }

    @Test
    void testProseWordStopsJuxtaposition() {
        ParseException e = assertThrows(ParseException.class, () -> expr("x is finite"));
        assertEquals("Unexpected 'is' after expression", e.getRawMessage());

        ParseException truth = assertThrows(ParseException.class, () -> expr("p true"));
        assertEquals("Unexpected 'true' after expression", truth.getRawMessage());
        assertIdentifier("false", binary("p = false").right());
    }

    @Test
    void testParenthesisedApplication() {
        FunctionApp app = assertInstanceOf(FunctionApp.class, expr("f(x, y)"));
        assertEquals(2, app.args().size());
        assertTrue(assertInstanceOf(FunctionApp.class, expr("f()")).args().isEmpty());
    }

    @Test
    void testSpacedParenthesisIsAnArgument() {
        FunctionApp app = assertInstanceOf(FunctionApp.class, expr("f (x)"));
        assertIdentifier("f", app.function());
        assertIdentifier("x", app.args().get(0));
    }

    @Test
    void testPrefixOperators() {
        UnaryOp size = assertInstanceOf(UnaryOp.class, binary("# s + 1").left());
        assertEquals("#", size.operator());
        UnaryOp not = assertInstanceOf(UnaryOp.class, binary("lnot p land q").left());
        assertEquals("lnot", not.operator());
        assertEquals("dom", assertInstanceOf(UnaryOp.class, expr("dom R")).operator());
    }

    @Test
    void testGenericInstantiation() {
        GenericInstantiation inst = assertInstanceOf(GenericInstantiation.class, expr("seq[N]"));
        assertIdentifier("seq", inst.base());
        assertEquals(1, inst.typeParams().size());
    }

    @Test
    void testTupleProjection() {
        TupleProjection first = assertInstanceOf(TupleProjection.class, expr("p.1"));
        assertEquals(1, first.index());
        assertFalse(first.named());

        TupleProjection field = assertInstanceOf(TupleProjection.class, expr("p.name"));
        assertEquals("name", field.field());
        assertTrue(field.named());
    }

    @Test
    void testProjectionInsideComprehensionBody() {
        SetComprehension set = assertInstanceOf(SetComprehension.class, expr("{ p : S | p.1 > 0 . p.2 }"));
        BinaryOp predicate = assertInstanceOf(BinaryOp.class, set.predicate());
        assertEquals(1, assertInstanceOf(TupleProjection.class, predicate.left()).index());
        assertEquals(2, assertInstanceOf(TupleProjection.class, set.expression()).index());
    }

    @Test
    void testOversizedProjectionIndex() {
        ParseException e = assertThrows(ParseException.class, () -> expr("x.99999999999"));
        assertEquals("Number too large: 99999999999", e.getRawMessage());
        assertEquals(3, e.getColumn());
    }

    @Test
    void testRelationalImage() {
        RelationalImage image = assertInstanceOf(RelationalImage.class, expr("R(| S |)"));
        assertIdentifier("R", image.relation());
        assertIdentifier("S", image.set());
    }

    @Test
    void testFunctionArrowsAreLeftAssociative() {
        FunctionType type = assertInstanceOf(FunctionType.class, expr("A -> B -> C"));
        assertIdentifier("C", type.range());
        FunctionType inner = assertInstanceOf(FunctionType.class, type.domain());
        assertIdentifier("A", inner.domain());
        assertIdentifier("B", inner.range());

        FunctionType partial = assertInstanceOf(FunctionType.class, expr("A +-> B +-> C"));
        assertEquals("+->", assertInstanceOf(FunctionType.class, partial.domain()).arrow());

        BinaryOp relation = binary("X -> Y <-> Z");
        assertEquals("<->", relation.operator());
        assertInstanceOf(FunctionType.class, relation.left());
    }

    @Test
    void testRange() {
        Range range = assertInstanceOf(Range.class, expr("1..10"));
        assertEquals("1", assertInstanceOf(NumberLiteral.class, range.start()).value());
        assertEquals("10", assertInstanceOf(NumberLiteral.class, range.end()).value());
    }

    // ========================================================================
    // Sets and tuples
    // ========================================================================

    @Test
    void testSetLiterals() {
        assertTrue(assertInstanceOf(SetLiteral.class, expr("{}")).elements().isEmpty());
        assertEquals(3, assertInstanceOf(SetLiteral.class, expr("{1, 2, 3}")).elements().size());
        SetLiteral maplets = assertInstanceOf(SetLiteral.class, expr("{a |-> 1, b |-> 2}"));
        assertEquals("|->", assertInstanceOf(BinaryOp.class, maplets.elements().get(0)).operator());
    }

    @Test
    void testSetComprehension() {
        SetComprehension set = assertInstanceOf(SetComprehension.class, expr("{ x : N | x > 0 . x * x }"));
        assertEquals(List.of("x"), set.variables());
        assertIdentifier("N", set.domain());
        assertNotNull(set.predicate());
        assertEquals("*", assertInstanceOf(BinaryOp.class, set.expression()).operator());
    }

    @Test
    void testSetComprehensionRejectsSemicolon() {
        assertThrows(ParseException.class, () -> expr("{ x : N; y : N | x = y }"));
    }

    @Test
    void testTuple() {
        Tuple tuple = assertInstanceOf(Tuple.class, expr("(a, b)"));
        assertEquals(2, tuple.elements().size());
        assertThrows(ParseException.class, () -> expr("(a, )"));
    }

    // ========================================================================
    // Errors and limits
    // ========================================================================

    @Test
    void testMissingQuantifierVariable() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> expr("forall | x"));
        assertEquals("Expected variable name after 'forall' (found '|')", e.getRawMessage());
        assertEquals(1, e.getLine());
        assertEquals(8, e.getColumn());
    }

    @Test
    void testUnexpectedEndOfInput() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> expr("x * ("));
        assertEquals("Unexpected end of input in expression", e.getRawMessage());
        assertEquals(6, e.getColumn());
    }

    @Test
    void testNestingLimit() {
        String deep = "(".repeat(12) + "x" + ")".repeat(12);
        NestingDepthException e = assertThrows(NestingDepthException.class, () -> Parser.parse(deep, 10));
        assertEquals(10, e.getMaxDepth());
        assertInstanceOf(Identifier.class, Parser.parse(deep, 100));

        String pathological = "(".repeat(5000) + "x" + ")".repeat(5000);
        assertThrows(NestingDepthException.class, () -> Parser.parse(pathological));
    }
}
