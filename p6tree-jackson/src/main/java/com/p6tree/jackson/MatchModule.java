package com.p6tree.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.p6tree.match.Match;

/**
 * Jackson module that configures serialization/deserialization of match trees.
 *
 * This module handles:
 * - Writing any {@link Match} as a from/to/hash/list object
 * - Reading a {@link MatchDocument} back into {@link com.p6tree.match.ParsedMatch} instances
 */
public class MatchModule extends SimpleModule {

    public MatchModule() {
        super("MatchModule", new Version(0, 3, 0, "SNAPSHOT", "com.p6tree", "p6tree-jackson"));
        addSerializer(Match.class, new MatchSerializer());
        addDeserializer(MatchDocument.class, new MatchDocumentDeserializer());
    }
}
