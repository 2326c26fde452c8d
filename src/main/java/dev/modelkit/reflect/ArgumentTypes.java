package dev.modelkit.reflect;

import com.fasterxml.jackson.databind.type.TypeFactory;
import dev.modelkit.json.ModelKitJsonMapper;
import java.lang.invoke.MethodType;
import java.lang.reflect.Executable;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Converts argument values to the declared types of the parameters they bind to. */
public final class ArgumentTypes {
    private ArgumentTypes() {}

    /**
     * Converts every value of {@code args} that binds to a parameter of {@code executable} into
     * that parameter's generic type. This is what loosely typed values need, e.g. a record read
     * back from JSON holds {@code Double} for a {@code float} and {@code List<Integer>} for a
     * {@code List<Long>}. Values that bind to no parameter are left alone for the binder to report.
     *
     * @throws IllegalArgumentException if a value cannot be converted
     */
    public static Arguments convert(Executable executable, Arguments args) {
        Parameter[] parameters = executable.getParameters();
        List<Parameter> named = new ArrayList<>();
        Parameter varPositional = null;
        for (int i = 0; i < parameters.length; i++) {
            if (executable.isVarArgs() && i == parameters.length - 1) {
                varPositional = parameters[i];
            } else if (!parameters[i].isAnnotationPresent(KeywordArgs.class)) {
                named.add(parameters[i]);
            }
        }

        List<Object> positional = new ArrayList<>();
        for (int i = 0; i < args.positional().size(); i++) {
            Object value = args.positional().get(i);
            if (i < named.size()) {
                Parameter parameter = named.get(i);
                positional.add(
                        convertTo(executable, parameter, parameter.getParameterizedType(), value));
            } else if (varPositional != null) {
                positional.add(
                        convertTo(
                                executable,
                                varPositional,
                                componentType(varPositional.getParameterizedType()),
                                value));
            } else {
                positional.add(value);
            }
        }

        Map<String, Parameter> byName = new LinkedHashMap<>();
        named.forEach(p -> byName.put(p.getName(), p));
        Map<String, Object> keywords = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : args.keywords().entrySet()) {
            Parameter parameter = byName.get(entry.getKey());
            keywords.put(
                    entry.getKey(),
                    parameter == null
                            ? entry.getValue()
                            : convertTo(
                                    executable,
                                    parameter,
                                    parameter.getParameterizedType(),
                                    entry.getValue()));
        }
        return Arguments.of(positional, keywords);
    }

    /**
     * Converts {@code value} to {@code type} only when it is not an instance of the raw type;
     * generic contents are not inspected.
     */
    @Nullable
    static Object coerce(
            Executable executable, Parameter parameter, Type type, @Nullable Object value) {
        if (value == null || boxed(TypeFactory.rawClass(type)).isInstance(value)) {
            return value;
        }
        return convertTo(executable, parameter, type, value);
    }

    static Type componentType(Type arrayType) {
        if (arrayType instanceof GenericArrayType generic) {
            return generic.getGenericComponentType();
        }
        return ((Class<?>) arrayType).getComponentType();
    }

    @Nullable
    private static Object convertTo(
            Executable executable, Parameter parameter, Type type, @Nullable Object value) {
        if (value == null) {
            return null;
        }
        try {
            return ModelKitJsonMapper.convert(value, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "%s argument '%s' of type %s cannot take %s value %s"
                            .formatted(
                                    Signature.describe(executable),
                                    parameter.getName(),
                                    type.getTypeName(),
                                    value.getClass().getSimpleName(),
                                    value),
                    e);
        }
    }

    private static Class<?> boxed(Class<?> type) {
        return MethodType.methodType(type).wrap().returnType();
    }
}
