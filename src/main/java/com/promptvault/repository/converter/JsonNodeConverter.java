package com.promptvault.repository.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.promptvault.exception.StorageException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * JPA converter storing an arbitrary JSON value as its compact text form.
 * A missing value is stored as an empty object.
 */
@Slf4j
@Converter
public class JsonNodeConverter implements AttributeConverter<JsonNode, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(JsonNode attribute) {
        if (attribute == null || attribute.isMissingNode()) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize usage input payload", e);
        }
    }

    @Override
    public JsonNode convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            return MAPPER.readTree(dbData);
        } catch (JsonProcessingException e) {
            log.error("Stored usage payload is not valid JSON, returning it as text", e);
            return JsonNodeFactory.instance.textNode(dbData);
        }
    }
}
