package com.unparen.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.unparen.ast.SyntaxNode;
import com.unparen.json.SyntaxJsonDeserializer;
import com.unparen.json.SyntaxJsonException;
import com.unparen.json.SyntaxJsonProvider;
import com.unparen.json.SyntaxJsonSerializer;

/**
 * The {@code "Jackson"} syntax JSON binding, backed by one mapper from
 * {@link UnparenJackson#createObjectMapper()}.
 */
public class JacksonSyntaxJsonProvider implements SyntaxJsonProvider {

    private final SyntaxJsonSerializer serializer;
    private final SyntaxJsonDeserializer deserializer;

    public JacksonSyntaxJsonProvider() {
        ObjectMapper mapper = UnparenJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public SyntaxJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public SyntaxJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    private static class JacksonSerializer implements SyntaxJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(SyntaxNode node) throws SyntaxJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to serialize " + node.kind(), e);
            }
        }

        @Override
        public String serializePretty(SyntaxNode node) throws SyntaxJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to serialize " + node.kind(), e);
            }
        }
    }

    private static class JacksonDeserializer implements SyntaxJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public SyntaxNode deserialize(String json) throws SyntaxJsonException {
            return deserialize(json, SyntaxNode.class);
        }

        @Override
        public <T extends SyntaxNode> T deserialize(String json, Class<T> type) throws SyntaxJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
