package com.jscst.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for {@link ObjectMapper}s that read and write concrete syntax trees.
 *
 * <pre>
 * ObjectMapper mapper = CstJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(script);
 * Script script = mapper.readValue(json, Script.class);
 * </pre>
 */
public final class CstJackson {

    private CstJackson() {
        // Utility class
    }

    /**
     * The returned mapper writes a "type" property on every node and semicolon, leaves out
     * absent optional parts unless {@link CstModule} asks for them, and ignores unknown
     * properties when reading.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // Semicolon.Implicit has no properties of its own, only its type id
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.registerModule(new CstModule());
        return mapper;
    }
}
