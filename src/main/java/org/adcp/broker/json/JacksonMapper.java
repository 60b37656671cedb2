package org.adcp.broker.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

public class JacksonMapper {

    private static final String FAILED_TO_DECODE = "Failed to decode: %s";

    private final ObjectMapper mapper;

    public JacksonMapper(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> ObjectNode encodeToObjectNode(T obj) throws EncodeException {
        final JsonNode node;
        try {
            node = mapper.valueToTree(obj);
        } catch (IllegalArgumentException e) {
            throw new EncodeException("Failed to encode as JSON object: " + e.getMessage());
        }
        if (node == null || !node.isObject()) {
            throw new EncodeException("Expected JSON object, got " + (node == null ? "null" : node.getNodeType()));
        }
        return (ObjectNode) node;
    }

    public <T> T convertValue(JsonNode node, Class<T> clazz) throws DecodeException {
        try {
            return mapper.treeToValue(node, clazz);
        } catch (JsonProcessingException e) {
            throw new DecodeException(String.format(FAILED_TO_DECODE, e.getMessage()), e);
        }
    }
}
