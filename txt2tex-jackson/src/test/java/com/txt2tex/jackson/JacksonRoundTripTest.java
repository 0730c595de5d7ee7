package com.txt2tex.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txt2tex.Parser;
import com.txt2tex.ast.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonRoundTripTest {

    private static final String SOURCE = """
            TITLE: Sample
            BIBLIOGRAPHY: refs.bib

            === Definitions ===
            given PERSON
            Status ::= active | suspended<N>
            Pair[X] == X cross X

            schema Register
              count : N
              members : P PERSON
            where
              count = # members
            also
              count < 100
            end

            ** Solution 1 **

            (a) forall x : N | x >= 0

            (b) { x : N | x > 0 . x * x }

            f(x) = a if x > 0
            b if x <= 0

            TRUTH TABLE:
            p | lnot p
            T | F
            F | T

            PROOF:
            p => q [=> intro from 1]
              [1] p [assumption]
                  q [from p]
            """;

    private final ObjectMapper mapper = Txt2TexJackson.createObjectMapper();

    @Test
    void testDocumentRoundTrip() throws Exception {
        Document document = Parser.parseDocument(SOURCE);
        String json = mapper.writeValueAsString(document);
        Document back = mapper.readValue(json, Document.class);
        assertEquals(document, back);
    }

    @Test
    void testParseResultRoundTrip() throws Exception {
        ParseResult expr = Parser.parse("lambda x : N . x * x + #<a, b>");
        String json = mapper.writeValueAsString(expr);
        ParseResult back = mapper.readValue(json, ParseResult.class);
        assertInstanceOf(Lambda.class, back);
        assertEquals(expr, back);
    }

    @Test
    void testTypeDiscriminatorMatchesNodeType() throws Exception {
        Document document = Parser.parseDocument("x = 1");
        JsonNode tree = mapper.readTree(mapper.writeValueAsString(document));
        assertEquals("Document", tree.get("type").asText());
        JsonNode item = tree.get("items").get(0);
        assertEquals("BinaryOp", item.get("type").asText());
        assertEquals("=", item.get("operator").asText());
        assertEquals("NumberLiteral", item.get("right").get("type").asText());
        assertEquals(1, item.get("line").asInt());
    }

    @Test
    void testAbsentPartsAreOmitted() throws Exception {
        JsonNode tree = mapper.readTree(mapper.writeValueAsString(Parser.parseExpression("forall x | p")));
        assertFalse(tree.has("domain"));
        assertFalse(tree.has("expression"));
        assertTrue(tree.get("variables").isArray());
    }

    @Test
    void testEveryRecordIsRegistered() {
        assertTrue(AstModule.nodeTypes().contains(ProofNode.class));
        assertTrue(AstModule.nodeTypes().contains(GuardedBranch.class));
        assertTrue(AstModule.nodeTypes().contains(Document.class));
        for (Class<?> type : AstModule.nodeTypes()) {
            assertTrue(type.isRecord(), type.getName());
        }
    }

    @Test
    void testUnknownFieldsAreIgnored() throws Exception {
        String json = "{\"type\":\"Identifier\",\"line\":2,\"column\":3,\"name\":\"x\",\"comment\":\"extra\"}";
        Expr expr = mapper.readValue(json, Expr.class);
        assertEquals(new Identifier(2, 3, "x"), expr);
    }
}
