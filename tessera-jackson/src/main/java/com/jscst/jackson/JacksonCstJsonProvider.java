package com.jscst.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jscst.ParseResult;
import com.jscst.cst.Node;
import com.jscst.cst.Script;
import com.jscst.json.CstJsonDeserializer;
import com.jscst.json.CstJsonException;
import com.jscst.json.CstJsonProvider;
import com.jscst.json.CstJsonSerializer;

/**
 * Jackson-based implementation of CstJsonProvider.
 */
public class JacksonCstJsonProvider implements CstJsonProvider {

    private final ObjectMapper mapper;
    private final CstJsonSerializer serializer;
    private final CstJsonDeserializer deserializer;

    public JacksonCstJsonProvider() {
        this.mapper = CstJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public CstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public CstJsonDeserializer getDeserializer() {
        return deserializer;
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

    private static class JacksonSerializer implements CstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws CstJsonException {
            return write(node, false, node.getClass().getSimpleName());
        }

        @Override
        public String serializePretty(Node node) throws CstJsonException {
            return write(node, true, node.getClass().getSimpleName());
        }

        @Override
        public String serialize(ParseResult result, boolean pretty) throws CstJsonException {
            return write(result, pretty, "ParseResult");
        }

        private String write(Object value, boolean pretty, String what) {
            try {
                return pretty
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                    : mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new CstJsonException("Failed to serialize " + what, e);
            }
        }
    }

    private static class JacksonDeserializer implements CstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Script deserializeScript(String json) throws CstJsonException {
            return deserialize(json, Script.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws CstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
