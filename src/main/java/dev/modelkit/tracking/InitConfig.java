package dev.modelkit.tracking;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.modelkit.json.ModelKitJsonMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.SneakyThrows;

/**
 * The configuration captured from one construction: parameter name to value, plus two reserved
 * entries, {@value #INIT_ARGS} (the raw positional arguments, when there were any) and
 * {@value #INIT_CLASS} (the simple name of the class constructed).
 *
 * <p>A record is created once, when construction completes, and nothing in modelkit changes it
 * afterwards. {@link #asMap()} is the live backing map, so callers can still mutate it.
 */
@EqualsAndHashCode
public final class InitConfig {
    public static final String INIT_ARGS = "init_args";
    public static final String INIT_CLASS = "init_class";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<>() {};

    private final Map<String, Object> values;

    InitConfig(Map<String, Object> values) {
        this.values = values;
    }

    public static InitConfig of(Map<String, ?> values) {
        return new InitConfig(new LinkedHashMap<>(values));
    }

    @Nullable
    public Object get(String name) {
        return values.get(name);
    }

    public boolean containsKey(String name) {
        return values.containsKey(name);
    }

    /** The raw positional arguments of the construction; empty when none were passed. */
    @SuppressWarnings("unchecked")
    public List<Object> initArgs() {
        Object raw = values.get(INIT_ARGS);
        return raw instanceof List<?> list ? (List<Object>) list : List.of();
    }

    public Optional<String> initClass() {
        return Optional.ofNullable(values.get(INIT_CLASS)).map(String::valueOf);
    }

    /** Every entry except the reserved ones. */
    public Map<String, Object> namedValues() {
        var named = new LinkedHashMap<>(values);
        named.remove(INIT_ARGS);
        named.remove(INIT_CLASS);
        return named;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public String toJson() {
        return ModelKitJsonMapper.toJson(values);
    }

    @SneakyThrows
    public static InitConfig fromJson(String json) {
        return new InitConfig(ModelKitJsonMapper.get().readValue(json, MAP_TYPE));
    }

    @Override
    public String toString() {
        return "InitConfig" + values;
    }
}
