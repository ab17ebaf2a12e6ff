package io.conformanceapi.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * Jackson codec for conformance API payloads.
 *
 * <p>The default mapper omits empty {@link java.util.Optional} fields, ignores unknown properties and writes
 * {@link io.conformanceapi.core.ServiceResult} values as {@code {"value": ...}} / {@code {"error": ...}}.
 */
public final class JacksonJsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a codec with the default conformance mapper.
     */
    public JacksonJsonCodec() {
        this(newObjectMapper());
    }

    /**
     * Creates a codec with a custom ObjectMapper. The mapper should have {@link ServiceResultModule} and the
     * JDK 8 module registered.
     *
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Builds the mapper used for every conformance API payload.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper(new JsonFactory())
                .registerModule(new Jdk8Module())
                .registerModule(new ServiceResultModule())
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    public JsonNode writeTree(Object value) throws JsonException {
        try {
            return mapper.valueToTree(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to tree", e);
        }
    }

    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getName(), e);
        }
    }

    public <T> List<T> readList(byte[] data, Class<T> elementType) throws JsonException {
        try {
            JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
            return mapper.readValue(data, listType);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to List<" + elementType.getName() + ">", e);
        }
    }

    public <T> T treeToValue(JsonNode node, Class<T> type) throws JsonException {
        try {
            return mapper.treeToValue(node, type);
        } catch (Exception e) {
            throw new JsonException("Failed to convert tree to " + type.getName(), e);
        }
    }

    public JsonNode readTree(InputStream input) throws JsonException {
        try {
            return mapper.readTree(input);
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON tree", e);
        }
    }
}
