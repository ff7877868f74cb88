package de.bsommerfeld.lexicon.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of the serialized columns. Lists keep their element order
 * and objects their key order on the way through.
 */
final class PayloadCodec {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    PayloadCodec() {
        this(new ObjectMapper());
    }

    PayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DatabaseException("Failed to encode payload", e);
        }
    }

    /** Encodes a list, writing {@code []} for {@code null}. */
    String encodeList(List<?> values) {
        return encode(values == null ? Collections.emptyList() : values);
    }

    JsonNode decodeTree(String json, String column) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PayloadDecodeException("Malformed " + column + " payload", e);
        }
    }

    List<JsonNode> decodeNodeList(String json, String column) {
        JsonNode tree = decodeTree(json, column);
        if (tree == null || !tree.isArray())
            throw new PayloadDecodeException("Expected a JSON array in " + column, null);
        List<JsonNode> nodes = new ArrayList<>(tree.size());
        tree.forEach(nodes::add);
        return Collections.unmodifiableList(nodes);
    }

    List<String> decodeStringList(String json, String column) {
        try {
            return Collections.unmodifiableList(mapper.readValue(json, STRING_LIST));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PayloadDecodeException("Malformed " + column + " payload", e);
        }
    }

    Map<String, String> decodeStringMap(String json, String column) {
        try {
            return Collections.unmodifiableMap(mapper.readValue(json, STRING_MAP));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PayloadDecodeException("Malformed " + column + " payload", e);
        }
    }
}
