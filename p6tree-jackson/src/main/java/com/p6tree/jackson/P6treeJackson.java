package com.p6tree.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Creates ObjectMappers that read and write {@link MatchDocument}s.
 *
 * <pre>
 * ObjectMapper mapper = P6treeJackson.createObjectMapper();
 * MatchDocument document = mapper.readValue(json, MatchDocument.class);
 * String json = mapper.writeValueAsString(new MatchDocument(orig, root));
 * </pre>
 */
public final class P6treeJackson {

    private P6treeJackson() {
    }

    /**
     * The returned mapper writes every match as a from/to/hash/list object and
     * rejects a hash that names the same capture twice, since the second would
     * silently replace the first.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        mapper.registerModule(new MatchModule());
        return mapper;
    }
}
