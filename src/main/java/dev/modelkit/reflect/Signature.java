package dev.modelkit.reflect;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.modelkit.json.ModelKitJsonMapper;
import java.lang.reflect.Executable;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The declared parameter list of a callable.
 *
 * @param parameterNames named parameters in declaration order; variadic parameters are excluded
 * @param defaults the parameters that declare a default, in declaration order, with their values
 * @param varPositional whether surplus positional arguments are accepted
 * @param varKeyword whether keyword arguments matching no named parameter are accepted
 */
public record Signature(
        List<String> parameterNames,
        Map<String, Object> defaults,
        boolean varPositional,
        boolean varKeyword) {

    public Signature {
        parameterNames = List.copyOf(parameterNames);
        defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public boolean hasParameter(String name) {
        return parameterNames.contains(name);
    }

    public boolean hasDefault(String name) {
        return defaults.containsKey(name);
    }

    /**
     * Reads the signature of a method or constructor. Parameter names come from the class file, so
     * the declaring class must be compiled with {@code -parameters}.
     *
     * @throws ReflectionException if parameter names are missing or a default is malformed
     */
    public static Signature of(Executable executable) {
        var names = new ArrayList<String>();
        var defaults = new LinkedHashMap<String, Object>();
        boolean varPositional = false;
        boolean varKeyword = false;

        Parameter[] parameters = executable.getParameters();
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            if (!parameter.isNamePresent()) {
                throw new ReflectionException(
                        "parameter names of %s are not available; compile with -parameters"
                                .formatted(describe(executable)));
            }
            if (executable.isVarArgs() && i == parameters.length - 1) {
                varPositional = true;
                continue;
            }
            if (parameter.isAnnotationPresent(KeywordArgs.class)) {
                if (!Map.class.isAssignableFrom(parameter.getType())) {
                    throw new ReflectionException(
                            "@KeywordArgs parameter %s of %s must be a Map"
                                    .formatted(parameter.getName(), describe(executable)));
                }
                varKeyword = true;
                continue;
            }
            names.add(parameter.getName());
            DefaultValue defaultValue = parameter.getAnnotation(DefaultValue.class);
            if (defaultValue != null) {
                defaults.put(
                        parameter.getName(),
                        readDefault(executable, parameter, defaultValue.value()));
            }
        }
        return new Signature(names, defaults, varPositional, varKeyword);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    private static Object readDefault(Executable executable, Parameter parameter, String literal) {
        if ("null".equals(literal)) {
            return null;
        }
        if (parameter.getType() == String.class) {
            return literal;
        }
        try {
            return ModelKitJsonMapper.fromJson(literal, parameter.getParameterizedType());
        } catch (JsonProcessingException e) {
            throw new ReflectionException(
                    "invalid default %s for parameter %s of %s"
                            .formatted(literal, parameter.getName(), describe(executable)),
                    e);
        }
    }

    static String describe(Executable executable) {
        return executable.getDeclaringClass().getSimpleName() + "." + executable.getName();
    }

    /** Assembles a signature by hand, for callables that declare what they accept. */
    public static class Builder {
        private final List<String> names = new ArrayList<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private boolean varPositional;
        private boolean varKeyword;

        public Builder parameter(String name) {
            names.add(name);
            return this;
        }

        public Builder parameter(String name, @Nullable Object defaultValue) {
            names.add(name);
            defaults.put(name, defaultValue);
            return this;
        }

        public Builder varPositional() {
            this.varPositional = true;
            return this;
        }

        public Builder varKeyword() {
            this.varKeyword = true;
            return this;
        }

        public Signature build() {
            return new Signature(names, defaults, varPositional, varKeyword);
        }
    }
}
