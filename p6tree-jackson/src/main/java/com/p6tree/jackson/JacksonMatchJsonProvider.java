package com.p6tree.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p6tree.json.MatchJsonException;
import com.p6tree.json.MatchJsonProvider;
import com.p6tree.json.MatchJsonReader;
import com.p6tree.json.MatchJsonWriter;
import com.p6tree.match.Match;

import java.io.InputStream;

/**
 * Jackson-based implementation of MatchJsonProvider.
 */
public class JacksonMatchJsonProvider implements MatchJsonProvider {

    private final ObjectMapper mapper;
    private final MatchJsonReader reader;
    private final MatchJsonWriter writer;

    public JacksonMatchJsonProvider() {
        this.mapper = P6treeJackson.createObjectMapper();
        this.reader = new JacksonReader(mapper);
        this.writer = new JacksonWriter(mapper);
    }

    @Override
    public MatchJsonReader getReader() {
        return reader;
    }

    @Override
    public MatchJsonWriter getWriter() {
        return writer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonReader implements MatchJsonReader {
        private final ObjectMapper mapper;

        JacksonReader(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Match read(String json) throws MatchJsonException {
            try {
                return mapper.readValue(json, MatchDocument.class).match();
            } catch (Exception e) {
                throw new MatchJsonException("Failed to read match tree", e);
            }
        }

        @Override
        public Match read(InputStream in) throws MatchJsonException {
            try {
                return mapper.readerFor(MatchDocument.class)
                    .without(JsonParser.Feature.AUTO_CLOSE_SOURCE)
                    .<MatchDocument>readValue(in)
                    .match();
            } catch (Exception e) {
                throw new MatchJsonException("Failed to read match tree", e);
            }
        }
    }

    private static class JacksonWriter implements MatchJsonWriter {
        private final ObjectMapper mapper;

        JacksonWriter(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String write(Match root) throws MatchJsonException {
            try {
                return mapper.writeValueAsString(new MatchDocument(root.orig(), root));
            } catch (Exception e) {
                throw new MatchJsonException("Failed to write match tree", e);
            }
        }

        @Override
        public String writePretty(Match root) throws MatchJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new MatchDocument(root.orig(), root));
            } catch (Exception e) {
                throw new MatchJsonException("Failed to write match tree", e);
            }
        }
    }
}
