package it.unimib.datai.handlerharness.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Jackson wrapper shared by request building, transport and outcome printing.
 */
public final class JsonCodec {
    private final ObjectMapper mapper;

    public JsonCodec() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write JSON", e);
        }
    }

    public String toPrettyJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write JSON", e);
        }
    }

    /**
     * Parses a JSON document into a tree. A null document yields a missing node;
     * content after the first value is rejected.
     */
    public JsonNode readTree(String json) throws JsonProcessingException {
        if (json == null) {
            return mapper.missingNode();
        }
        return mapper.readTree(json);
    }
}
