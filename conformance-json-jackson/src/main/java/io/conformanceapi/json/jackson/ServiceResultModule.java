package io.conformanceapi.json.jackson;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.conformanceapi.core.ServiceResult;

/**
 * Registers the wire form of {@link ServiceResult}.
 */
public final class ServiceResultModule extends SimpleModule {

    @SuppressWarnings("unchecked")
    public ServiceResultModule() {
        super("ServiceResultModule");
        Class<ServiceResult<?>> type = (Class<ServiceResult<?>>) (Class<?>) ServiceResult.class;
        addSerializer(type, new ServiceResultSerializer());
        addDeserializer(type, new ServiceResultDeserializer());
    }
}
