package com.zeronote.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Jackson settings shared by the local stores, the file remote and the HTTP remote, so a
 * payload written by one reads back in the others.
 */
public final class ZeroNoteJson {

    private ZeroNoteJson() {
    }

    public static ObjectMapper newMapper() {
        return configure(new ObjectMapper());
    }

    /** Applies the shared settings to a mapper built elsewhere, such as Spring's. */
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, true);
    }
}
