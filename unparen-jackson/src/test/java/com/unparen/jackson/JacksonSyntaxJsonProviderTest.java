package com.unparen.jackson;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.unparen.ast.BinaryExpression;
import com.unparen.ast.IdentifierName;
import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.PatternSyntax;
import com.unparen.ast.ReturnStatement;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;
import com.unparen.ast.TokenKind;
import com.unparen.json.SyntaxJsonDeserializer;
import com.unparen.json.SyntaxJsonException;
import com.unparen.json.SyntaxJsonProvider;
import com.unparen.json.SyntaxJsonSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.unparen.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class JacksonSyntaxJsonProviderTest {

    private static final ObjectMapper STRICT = JsonMapper.builder()
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .build();

    private SyntaxJsonSerializer serializer;
    private SyntaxJsonDeserializer deserializer;

    @BeforeEach
    void setUp() {
        SyntaxJsonProvider provider = new JacksonSyntaxJsonProvider();
        serializer = provider.getSerializer();
        deserializer = provider.getDeserializer();
    }

    private JsonNode tree(SyntaxNode node) throws Exception {
        return STRICT.readTree(serializer.serialize(node));
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(SyntaxJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonSyntaxJsonProvider.class, SyntaxJsonProvider.getProvider());
        assertEquals("Jackson", SyntaxJsonProvider.getProvider("jackson").getName());
    }

    @Test
    void testReadTreeThroughDiscoveredProvider() {
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.MULTIPLY_EXPRESSION, identifier("b"), identifier("c")));
        String json = SyntaxJsonProvider.write(returnStatement(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), node)));

        SyntaxTree tree = SyntaxJsonProvider.readTree(json);
        ReturnStatement statement = assertInstanceOf(ReturnStatement.class, tree.root());
        BinaryExpression sum = assertInstanceOf(BinaryExpression.class, statement.expression());
        assertEquals(node, sum.right());
        assertSame(sum, tree.parent(sum.right()));
        assertThrows(SyntaxJsonException.class, () -> SyntaxJsonProvider.readTree("{\"syntax\": \"NoSuchNode\"}"));
    }

    @Test
    void testRoundTripPreservesStructure() {
        PatternSyntax arm = parenthesizedPattern(binaryPattern(SyntaxKind.OR_PATTERN,
            constantPattern(numericLiteral("1")), relationalPattern(TokenKind.GREATER_THAN, numericLiteral("9"))));
        SyntaxNode root = block(
            localDeclaration(predefinedType("var"), "f", lambda("x", block(
                ifStatement(isPattern(identifier("x"), notPattern(constantPattern(nullLiteral()))),
                    returnStatement(interpolatedString(interpolatedText("v="),
                        interpolation(parenthesized(conditional(identifier("x"), stringLiteral("a"),
                            stringLiteral("b"))), "N2")))),
                returnStatement(null)))),
            expressionStatement(assign(identifier("y"), switchExpression(identifier("n"),
                switchArm(arm, stringLiteral("small")),
                switchArm(discardPattern(), stringLiteral("other"))))),
            expressionStatement(invocation(memberAccess(thisExpression(), "Run"),
                binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), parenthesized(
                    binary(SyntaxKind.MULTIPLY_EXPRESSION, identifier("b"), identifier("c")))))));

        String json = serializer.serialize(root);
        SyntaxNode copy = deserializer.deserialize(json);
        assertEquals(root, copy);
        assertNotSame(root, copy);
        assertEquals(json, serializer.serialize(copy));
        assertEquals(SyntaxTree.textOf(root), SyntaxTree.textOf(copy));
    }

    @Test
    void testNodesCarrySyntaxAndKind() throws Exception {
        ParenthesizedExpression node = parenthesized(binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), identifier("b")));
        JsonNode json = tree(returnStatement(node));

        assertEquals("ReturnStatement", json.get("syntax").asText());
        assertEquals("RETURN_STATEMENT", json.get("kind").asText());
        JsonNode parenthesized = json.get("expression");
        assertEquals("ParenthesizedExpression", parenthesized.get("syntax").asText());
        assertEquals("PARENTHESIZED_EXPRESSION", parenthesized.get("kind").asText());
        JsonNode sum = parenthesized.get("expression");
        assertEquals("BinaryExpression", sum.get("syntax").asText());
        assertEquals("ADD_EXPRESSION", sum.get("kind").asText());
        assertEquals("IdentifierName", sum.get("left").get("syntax").asText());
        assertEquals("a", sum.get("left").get("identifier").get("text").asText());
    }

    @Test
    void testTokensAndOptionalSlots() throws Exception {
        ParenthesizedExpression node = new ParenthesizedExpression(
            token(TokenKind.OPEN_PAREN), identifier("x"), missingToken(TokenKind.CLOSE_PAREN));
        JsonNode json = tree(node);

        JsonNode open = json.get("openParenToken");
        assertEquals("OPEN_PAREN", open.get("kind").asText());
        assertEquals("(", open.get("text").asText());
        assertFalse(open.has("missing"));
        assertTrue(json.get("closeParenToken").get("missing").asBoolean());

        JsonNode bare = tree(returnStatement(null));
        assertFalse(bare.has("expression"));

        JsonNode hole = tree(interpolation(identifier("x")));
        assertFalse(hole.has("formatClause"));
    }

    @Test
    void testFixedTextMayBeOmittedOnInput() {
        String json = """
            {
              "syntax": "ParenthesizedExpression",
              "comment": "unknown properties are ignored",
              "openParenToken": {"kind": "OPEN_PAREN"},
              "expression": {"syntax": "IdentifierName", "kind": "IDENTIFIER_NAME",
                             "identifier": {"kind": "IDENTIFIER", "text": "x"}},
              "closeParenToken": {"kind": "CLOSE_PAREN"}
            }
            """;
        assertEquals(parenthesized(identifier("x")), deserializer.deserialize(json));
        assertEquals(parenthesized(identifier("x")), deserializer.deserialize(json, ParenthesizedExpression.class));
    }

    @Test
    void testDeserializeTreeIsReadyForDecisions() {
        BinaryExpression sum = binary(SyntaxKind.ADD_EXPRESSION, identifier("a"), parenthesized(identifier("b")));
        SyntaxTree tree = deserializer.deserializeTree(serializer.serialize(returnStatement(sum)));

        ReturnStatement statement = assertInstanceOf(ReturnStatement.class, tree.root());
        BinaryExpression copy = assertInstanceOf(BinaryExpression.class, statement.expression());
        assertSame(copy, tree.parent(copy.right()));
        assertEquals(List.of("return", "a", "+", "(", "b", ")", ";"),
            tree.tokens().stream().map(t -> t.text()).toList());
    }

    @Test
    void testFailuresAreWrapped() {
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserialize("{"));
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserialize("{\"syntax\": \"NoSuchSyntax\"}"));

        // BinaryExpression cannot carry a statement kind
        String wrongKind = """
            {"syntax": "BinaryExpression", "kind": "IF_STATEMENT",
             "left": {"syntax": "IdentifierName", "identifier": {"kind": "IDENTIFIER", "text": "a"}},
             "operatorToken": {"kind": "PLUS"},
             "right": {"syntax": "IdentifierName", "identifier": {"kind": "IDENTIFIER", "text": "b"}}}
            """;
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserialize(wrongKind));

        // identifiers have no fixed text
        String noText = "{\"syntax\": \"IdentifierName\", \"identifier\": {\"kind\": \"IDENTIFIER\"}}";
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserialize(noText));

        String parenthesized = serializer.serialize(parenthesized(identifier("x")));
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserialize(parenthesized, IdentifierName.class));
    }

    @Test
    void testPrettyOutputMatchesCompactOutput() throws Exception {
        SyntaxNode node = expressionStatement(assign(identifier("x"), parenthesized(identifier("y"))));
        String pretty = serializer.serializePretty(node);
        assertTrue(pretty.contains("\n"));
        assertEquals(STRICT.readTree(serializer.serialize(node)), STRICT.readTree(pretty));
    }

    @Test
    void testEveryRecordIsRegistered() {
        long records = SyntaxModule.syntaxTypes().stream().filter(Class::isRecord).count();
        assertTrue(records >= 80, "found " + records);
        assertTrue(SyntaxModule.syntaxTypes().contains(ParenthesizedExpression.class));
        assertTrue(SyntaxModule.syntaxTypes().contains(PatternSyntax.class));
    }
}
