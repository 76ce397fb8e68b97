package me.internalizable.proxyfleet.manager.registry;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.internalizable.proxyfleet.api.ProxyType;

import javax.annotation.Nonnull;

/**
 * JSON mapping of instance records.
 *
 * <p>Property names are snake_case, timestamps ISO-8601 and enums use their
 * lowercase wire names, which is the shape external tooling reads.</p>
 */
public final class RecordMapper {

    private RecordMapper() {
    }

    /**
     * Create an object mapper configured for instance records.
     *
     * @return a new mapper
     */
    @Nonnull
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING);
        mapper.enable(DeserializationFeature.READ_ENUMS_USING_TO_STRING);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.addHandler(new LegacyValueHandler());
        return mapper;
    }

    /**
     * Maps values written by older releases.
     */
    private static final class LegacyValueHandler extends DeserializationProblemHandler {

        @Override
        public Object handleWeirdStringValue(DeserializationContext context, Class<?> targetType,
                                             String valueToConvert, String failureMsg) {
            if (targetType == ProxyType.class && "squid".equalsIgnoreCase(valueToConvert)) {
                return ProxyType.FORWARD_PROXY;
            }
            return NOT_HANDLED;
        }
    }
}
