package com.txt2tex.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write txt2tex trees.
 *
 * <pre>
 * ObjectMapper mapper = Txt2TexJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(document);
 * Document back = mapper.readValue(json, Document.class);
 * </pre>
 */
public final class Txt2TexJackson {

    private Txt2TexJackson() {
    }

    /**
     * Creates a mapper that tags every node with its {@code "type"}, leaves out
     * absent optional parts and tolerates fields it does not know.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Optional parts (domain, justification, genericParams...) are omitted when null
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());
        return mapper;
    }
}
