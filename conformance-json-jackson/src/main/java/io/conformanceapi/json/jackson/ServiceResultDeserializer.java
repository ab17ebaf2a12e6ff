package io.conformanceapi.json.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conformanceapi.core.ServiceError;
import io.conformanceapi.core.ServiceResult;

import java.io.IOException;

/**
 * Reads {@code {"error": {...}}} or {@code {"value": ...}}. The value type is resolved from the declared
 * {@code ServiceResult<T>} parameter; an object with neither member reads as a value arm holding {@code null}.
 */
final class ServiceResultDeserializer extends StdDeserializer<ServiceResult<?>> implements ContextualDeserializer {

    private final JavaType valueType;

    ServiceResultDeserializer() {
        this(null);
    }

    private ServiceResultDeserializer(JavaType valueType) {
        super(ServiceResult.class);
        this.valueType = valueType;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType declared = ctxt.getContextualType();
        if (declared == null && property != null) declared = property.getType();
        JavaType content = declared == null ? null : declared.containedType(0);
        return new ServiceResultDeserializer(content != null ? content : ctxt.constructType(Object.class));
    }

    @Override
    public ServiceResult<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        if (!node.isObject()) {
            return ctxt.reportInputMismatch(this, "result must be a JSON object with 'value' or 'error'");
        }

        JsonNode error = node.get("error");
        if (error != null && !error.isNull()) {
            return ServiceResult.failure(ctxt.readTreeAsValue(error, ServiceError.class));
        }

        JsonNode value = node.get("value");
        if (value != null && !value.isNull()) {
            JavaType type = valueType != null ? valueType : ctxt.constructType(Object.class);
            return ServiceResult.value(ctxt.readTreeAsValue(value, type));
        }
        return ServiceResult.value(null);
    }
}
