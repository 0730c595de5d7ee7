package com.txt2tex.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txt2tex.ast.Document;
import com.txt2tex.ast.Node;
import com.txt2tex.ast.ParseResult;
import com.txt2tex.json.AstJsonDeserializer;
import com.txt2tex.json.AstJsonException;
import com.txt2tex.json.AstJsonProvider;
import com.txt2tex.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(Txt2TexJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public ParseResult deserializeResult(String json) throws AstJsonException {
            return deserialize(json, ParseResult.class);
        }

        @Override
        public Document deserializeDocument(String json) throws AstJsonException {
            return deserialize(json, Document.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
