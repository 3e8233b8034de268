package com.p6tree.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.p6tree.match.Match;
import com.p6tree.match.ParsedMatch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link MatchDocument}. Every match needs the source text, which only
 * the top-level object carries, so the document is read as a tree first and the
 * matches are built from it.
 */
public class MatchDocumentDeserializer extends JsonDeserializer<MatchDocument> {

    @Override
    public MatchDocument deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        JsonNode orig = root.get("orig");
        if (orig == null || !orig.isTextual()) {
            throw JsonMappingException.from(p, "Match document has no \"orig\" source text");
        }
        JsonNode match = root.get("match");
        if (match == null || !match.isObject()) {
            throw JsonMappingException.from(p, "Match document has no \"match\" object");
        }
        return new MatchDocument(orig.asText(), toMatch(orig.asText(), match, p));
    }

    private Match toMatch(String orig, JsonNode node, JsonParser p) throws IOException {
        JsonNode from = node.get("from");
        JsonNode to = node.get("to");
        if (from == null || !from.canConvertToInt() || to == null || !to.canConvertToInt()) {
            throw JsonMappingException.from(p, "Match without integer \"from\" and \"to\": " + node);
        }
        ParsedMatch.Builder builder;
        try {
            builder = ParsedMatch.builder(orig, from.asInt(), to.asInt());
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }

        JsonNode hash = node.get("hash");
        if (hash != null && !hash.isNull()) {
            Iterator<Map.Entry<String, JsonNode>> fields = hash.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isArray()) {
                    List<Match> captures = new ArrayList<>();
                    for (JsonNode capture : value) {
                        captures.add(toMatch(orig, capture, p));
                    }
                    builder.putAll(field.getKey(), captures);
                } else if (value.isObject()) {
                    builder.put(field.getKey(), toMatch(orig, value, p));
                } else {
                    throw JsonMappingException.from(p,
                        "Capture \"" + field.getKey() + "\" is neither a match nor a list of matches");
                }
            }
        }

        JsonNode list = node.get("list");
        if (list != null && list.isArray()) {
            for (JsonNode item : list) {
                builder.add(toMatch(orig, item, p));
            }
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
