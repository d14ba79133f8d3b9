package com.easytidal.mirror.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Reads an {@link Instant} from any ISO-8601 form {@link Timestamps} accepts,
 * so files written with zone-less local times still load.
 */
public class LenientInstantDeserializer extends StdScalarDeserializer<Instant> {

    public LenientInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String text = p.getValueAsString();
        return Timestamps.parse(text).orElseThrow(() ->
                ctxt.weirdStringException(text, Instant.class, "not an ISO-8601 timestamp"));
    }
}
