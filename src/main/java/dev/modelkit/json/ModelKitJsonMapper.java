package dev.modelkit.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import lombok.SneakyThrows;

/**
 * Centralized ObjectMapper for modelkit. It parses {@code @DefaultValue} literals, writes and
 * reads construction records, and converts record values back to parameter types.
 */
public final class ModelKitJsonMapper {

    private static volatile ObjectMapper instance;
    private static final List<Consumer<ObjectMapper>> configurers = new ArrayList<>();
    private static volatile boolean initialized = false;

    /** Default configuration applied to all ObjectMapper instances. */
    private static final Consumer<ObjectMapper> DEFAULT_CONFIG =
            objectMapper -> {
                objectMapper
                        .registerModule(new JavaTimeModule())
                        .registerModule(new Jdk8Module())
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            };

    static {
        configurers.add(DEFAULT_CONFIG);
    }

    private ModelKitJsonMapper() {}

    public static ObjectMapper get() {
        if (instance == null) {
            synchronized (ModelKitJsonMapper.class) {
                if (instance == null) {
                    var mapper = new ObjectMapper();
                    for (Consumer<ObjectMapper> configurer : configurers) {
                        configurer.accept(mapper);
                    }
                    instance = mapper;
                    initialized = true;
                }
            }
        }
        return instance;
    }

    public static synchronized void configure(Consumer<ObjectMapper> configurer) {
        if (initialized) {
            throw new IllegalStateException(
                    "ModelKitJsonMapper has already been initialized. "
                            + "configure() must be called before the first call to get().");
        }
        configurers.add(configurer);
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return get().writeValueAsString(o);
    }

    @SneakyThrows
    public static <T> T fromJson(String jsonString, Class<T> targetClass) {
        return get().readValue(jsonString, targetClass);
    }

    /**
     * Reads a JSON literal into an arbitrary (possibly generic or primitive) reflected type.
     *
     * <p>Unlike the other helpers this one lets Jackson's checked exception through so callers can
     * report which literal was malformed.
     */
    public static Object fromJson(String jsonString, Type targetType)
            throws JsonProcessingException {
        return get().readValue(jsonString, javaType(targetType));
    }

    /**
     * Converts a loosely typed value, such as a number or list read back from JSON, into a
     * reflected type. Values already of a non-generic target type are returned as they are.
     *
     * @throws IllegalArgumentException if the value cannot be represented as the target type
     */
    @Nullable
    public static Object convert(@Nullable Object value, Type targetType) {
        return get().convertValue(value, javaType(targetType));
    }

    private static JavaType javaType(Type type) {
        return get().getTypeFactory().constructType(type);
    }

    static synchronized void reset() {
        instance = null;
        configurers.clear();
        configurers.add(DEFAULT_CONFIG);
        initialized = false;
    }
}
