package com.p6tree.jackson;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p6tree.Factory;
import com.p6tree.ast.Comment;
import com.p6tree.ast.Document;
import com.p6tree.ast.Element;
import com.p6tree.ast.HereDocBody;
import com.p6tree.ast.Statement;
import com.p6tree.json.MatchJsonException;
import com.p6tree.json.MatchJsonProvider;
import com.p6tree.json.MatchJsonReader;
import com.p6tree.json.MatchJsonWriter;
import com.p6tree.match.Match;
import com.p6tree.match.ParsedMatch;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonMatchJsonProviderTest {

    private final MatchJsonProvider provider = new JacksonMatchJsonProvider();

    @Test
    void testDiscoveredThroughServiceLoader() {
        assertTrue(MatchJsonProvider.isProviderAvailable());
        MatchJsonProvider found = MatchJsonProvider.getProvider();
        assertInstanceOf(JacksonMatchJsonProvider.class, found);
        assertEquals("Jackson", found.getName());
        assertInstanceOf(JacksonMatchJsonProvider.class, MatchJsonProvider.getProvider("jackson"));
        assertEquals(1, MatchJsonProvider.providers().size());

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> MatchJsonProvider.getProvider("Gson"));
        assertTrue(e.getMessage().contains("'Gson'"), e.getMessage());
    }

    @Test
    void testReadSimpleMatch() {
        String json = """
            {
              "orig": "42",
              "match": {
                "from": 0,
                "to": 2,
                "hash": {
                  "statementlist": { "from": 0, "to": 2, "hash": { "statement": [] } }
                },
                "extra": "ignored"
              }
            }
            """;

        Match root = provider.read(json);

        assertEquals("42", root.orig());
        assertEquals(0, root.from());
        assertEquals(2, root.to());
        Match statementlist = root.get("statementlist");
        assertEquals(List.of("statement"), new ArrayList<>(statementlist.keys()));
        assertTrue(statementlist.getAll("statement").isEmpty());
        assertNull(statementlist.get("statement"));
    }

    @Test
    void testBuildFromFixture() throws IOException {
        Match root;
        try (InputStream in = fixture("declaration.json")) {
            root = provider.getReader().read(in);
        }
        Document document = new Factory().build(root);

        assertEquals(root.orig(), document.text());
        assertEquals(List.of("Statement", "WS", "Comment", "WS", "Statement", "WS"), types(document.children()));
        assertEquals("# the answer", ((Comment) document.child(2)).content());

        Statement declaration = document.statements().get(0);
        assertEquals("my $x = 1;", declaration.text());
        assertEquals(List.of("ScopeDeclarator", "WS", "Operator.Infix", "WS", "DecimalNumber", "Semicolon"),
            types(declaration.children()));
        Statement say = document.statements().get(1);
        assertEquals(List.of("Bareword", "WS", "Variable", "Semicolon"), types(say.children()));
    }

    @Test
    void testBuildHereDocFixture() throws IOException {
        Match root;
        try (InputStream in = fixture("heredoc.json")) {
            root = provider.getReader().read(in);
        }
        Document document = new Factory().build(root);

        assertEquals(List.of("Statement", "WS", "HereDocBody", "WS", "Statement", "WS"), types(document.children()));
        assertEquals("First line\nEND", ((HereDocBody) document.child(2)).content());
        assertEquals(2, document.semanticChildren().size());
    }

    @Test
    void testWriteThenReadBuildsTheSameDocument() throws IOException {
        Match original;
        try (InputStream in = fixture("declaration.json")) {
            original = provider.getReader().read(in);
        }
        MatchJsonWriter writer = provider.getWriter();

        String json = writer.write(original);
        Match reread = provider.getReader().read(json);
        Match fromPretty = provider.getReader().read(writer.writePretty(original));

        Factory factory = new Factory();
        List<String> expected = linkTexts(factory.build(original));
        assertEquals(expected, linkTexts(factory.build(reread)));
        assertEquals(expected, linkTexts(factory.build(fromPretty)));
    }

    @Test
    void testWriterKeepsEmptyQuantifiedCaptures() throws IOException {
        ParsedMatch root = ParsedMatch.builder("", 0, 0)
            .put("statementlist", ParsedMatch.builder("", 0, 0).putAll("statement", List.of()).build())
            .build();

        String json = provider.getWriter().write(root);
        ObjectMapper mapper = ((JacksonMatchJsonProvider) provider).getObjectMapper();
        JsonNode tree = mapper.readTree(json);

        assertEquals("", tree.get("orig").asText());
        JsonNode statements = tree.get("match").get("hash").get("statementlist").get("hash").get("statement");
        assertTrue(statements.isArray());
        assertEquals(0, statements.size());
        assertNull(tree.get("match").get("list"));

        Match reread = provider.getReader().read(json);
        assertTrue(reread.get("statementlist").keys().contains("statement"));
    }

    @Test
    void testMalformedDocuments() {
        MatchJsonReader reader = provider.getReader();

        MatchJsonException noOrig = assertThrows(MatchJsonException.class,
            () -> reader.read("{\"match\": {\"from\": 0, \"to\": 0}}"));
        assertInstanceOf(JsonMappingException.class, noOrig.getCause());
        assertTrue(noOrig.getCause().getMessage().contains("\"orig\""), noOrig.getCause().getMessage());

        MatchJsonException outOfRange = assertThrows(MatchJsonException.class,
            () -> reader.read("{\"orig\": \"ab\", \"match\": {\"from\": 0, \"to\": 9}}"));
        assertInstanceOf(JsonMappingException.class, outOfRange.getCause());

        MatchJsonException noOffsets = assertThrows(MatchJsonException.class,
            () -> reader.read("{\"orig\": \"ab\", \"match\": {\"from\": \"zero\", \"to\": 2}}"));
        assertTrue(noOffsets.getCause().getMessage().contains("\"from\""), noOffsets.getCause().getMessage());

        MatchJsonException badCapture = assertThrows(MatchJsonException.class,
            () -> reader.read("{\"orig\": \"ab\", \"match\": {\"from\": 0, \"to\": 2, \"hash\": {\"sym\": 5}}}"));
        assertTrue(badCapture.getCause().getMessage().contains("\"sym\""), badCapture.getCause().getMessage());

        assertThrows(MatchJsonException.class, () -> reader.read(
            "{\"orig\": \"ab\", \"match\": {\"from\": 0, \"to\": 2, \"hash\": "
                + "{\"sym\": {\"from\": 0, \"to\": 1}, \"sym\": {\"from\": 1, \"to\": 2}}}}"));

        assertThrows(MatchJsonException.class, () -> reader.read("{"));
    }

    private static InputStream fixture(String name) {
        InputStream in = JacksonMatchJsonProviderTest.class.getResourceAsStream("/matches/" + name);
        assertNotNull(in, "missing fixture " + name);
        return in;
    }

    private static List<String> types(List<? extends Element> elements) {
        List<String> types = new ArrayList<>();
        for (Element element : elements) {
            types.add(element.type());
        }
        return types;
    }

    private static List<String> linkTexts(Document document) {
        List<String> texts = new ArrayList<>();
        for (Element link : document.links()) {
            texts.add(link.type() + ":" + link.text());
        }
        return texts;
    }
}
