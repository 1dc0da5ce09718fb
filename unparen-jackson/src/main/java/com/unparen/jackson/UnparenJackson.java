package com.unparen.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = UnparenJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(node);
 * SyntaxNode node = mapper.readValue(json, SyntaxNode.class);
 * </pre>
 */
public final class UnparenJackson {

    private UnparenJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic SyntaxNode types via the "syntax" property
     * - Writes a "kind" property for every node, including single-kind records
     * - Omits absent optional slots and the "missing" flag of present tokens
     * - Ignores unknown properties, including "kind" where it is not a record component
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optional slots are omitted
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new SyntaxModule());

        return mapper;
    }
}
