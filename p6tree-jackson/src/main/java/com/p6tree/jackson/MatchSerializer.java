package com.p6tree.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.p6tree.match.Match;

import java.io.IOException;
import java.util.List;

/**
 * Writes a match as {@code {"from", "to", "hash", "list"}}. The source text is
 * written once, by the enclosing {@link MatchDocument}, not per match.
 *
 * <p>A key with exactly one capture is written as an object, any other number
 * of captures as an array, so a quantified capture that matched nothing stays
 * present.</p>
 */
public class MatchSerializer extends JsonSerializer<Match> {

    @Override
    public void serialize(Match match, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("from", match.from());
        gen.writeNumberField("to", match.to());
        if (!match.keys().isEmpty()) {
            gen.writeObjectFieldStart("hash");
            for (String key : match.keys()) {
                List<Match> captures = match.getAll(key);
                gen.writeFieldName(key);
                if (captures.size() == 1) {
                    serialize(captures.get(0), gen, serializers);
                } else {
                    writeArray(captures, gen, serializers);
                }
            }
            gen.writeEndObject();
        }
        if (!match.list().isEmpty()) {
            gen.writeFieldName("list");
            writeArray(match.list(), gen, serializers);
        }
        gen.writeEndObject();
    }

    private void writeArray(List<Match> matches, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeStartArray();
        for (Match match : matches) {
            serialize(match, gen, serializers);
        }
        gen.writeEndArray();
    }
}
