package io.conformanceapi.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.conformanceapi.core.ServiceResult;

import java.io.IOException;

/**
 * Writes {@code {"error": {...}}} for a failure and {@code {"value": ...}} for a value. A value arm holding
 * {@code null} is written as an empty object.
 */
final class ServiceResultSerializer extends StdSerializer<ServiceResult<?>> {

    ServiceResultSerializer() {
        super(ServiceResult.class, false);
    }

    @Override
    public void serialize(ServiceResult<?> result, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (result instanceof ServiceResult.Failure<?> failure) {
            provider.defaultSerializeField("error", failure.error(), gen);
        } else if (result instanceof ServiceResult.Value<?> value && value.value() != null) {
            provider.defaultSerializeField("value", value.value(), gen);
        }
        gen.writeEndObject();
    }
}
