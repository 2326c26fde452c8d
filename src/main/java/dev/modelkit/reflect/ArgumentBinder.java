package dev.modelkit.reflect;

import java.lang.reflect.Array;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Maps positional and keyword {@link Arguments} onto the Java parameters of a method. */
final class ArgumentBinder {
    private ArgumentBinder() {}

    /**
     * Resolves the Java argument array for a call.
     *
     * @throws IllegalArgumentException if the arguments do not fit the parameter list
     */
    static Object[] bind(Executable executable, Arguments args) {
        Signature signature = Signature.of(executable);
        Parameter[] parameters = executable.getParameters();
        Object[] values = new Object[parameters.length];
        boolean[] assigned = new boolean[parameters.length];

        int varPositionalIndex = executable.isVarArgs() ? parameters.length - 1 : -1;
        int varKeywordIndex = -1;
        List<Integer> named = new ArrayList<>();
        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < parameters.length; i++) {
            if (i == varPositionalIndex) {
                continue;
            }
            if (parameters[i].isAnnotationPresent(KeywordArgs.class)) {
                varKeywordIndex = i;
                continue;
            }
            named.add(i);
            indexByName.put(parameters[i].getName(), i);
        }

        List<Object> positional = args.positional();
        if (positional.size() > named.size() && varPositionalIndex < 0) {
            throw new IllegalArgumentException(
                    "%s takes %d positional arguments but %d were given"
                            .formatted(
                                    Signature.describe(executable),
                                    named.size(),
                                    positional.size()));
        }
        int boundPositionally = Math.min(positional.size(), named.size());
        for (int i = 0; i < boundPositionally; i++) {
            values[named.get(i)] = positional.get(i);
            assigned[named.get(i)] = true;
        }
        if (varPositionalIndex >= 0) {
            Parameter varPositional = parameters[varPositionalIndex];
            Type componentType = ArgumentTypes.componentType(varPositional.getParameterizedType());
            int surplus = positional.size() - boundPositionally;
            Object packed = Array.newInstance(varPositional.getType().getComponentType(), surplus);
            for (int i = 0; i < surplus; i++) {
                Object value = positional.get(boundPositionally + i);
                Array.set(
                        packed,
                        i,
                        ArgumentTypes.coerce(executable, varPositional, componentType, value));
            }
            values[varPositionalIndex] = packed;
        }

        Map<String, Object> extraKeywords = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : args.keywords().entrySet()) {
            Integer index = indexByName.get(entry.getKey());
            if (index != null) {
                if (assigned[index]) {
                    throw new IllegalArgumentException(
                            "%s got multiple values for argument '%s'"
                                    .formatted(Signature.describe(executable), entry.getKey()));
                }
                values[index] = entry.getValue();
                assigned[index] = true;
            } else if (varKeywordIndex >= 0) {
                extraKeywords.put(entry.getKey(), entry.getValue());
            } else {
                throw new IllegalArgumentException(
                        "%s got an unexpected keyword argument '%s'"
                                .formatted(Signature.describe(executable), entry.getKey()));
            }
        }
        if (varKeywordIndex >= 0) {
            values[varKeywordIndex] = extraKeywords;
        }

        for (int index : named) {
            if (assigned[index]) {
                continue;
            }
            String name = parameters[index].getName();
            if (!signature.hasDefault(name)) {
                throw new IllegalArgumentException(
                        "%s missing required argument '%s'"
                                .formatted(Signature.describe(executable), name));
            }
            values[index] = signature.defaults().get(name);
        }
        for (int index : named) {
            Parameter parameter = parameters[index];
            values[index] =
                    ArgumentTypes.coerce(
                            executable, parameter, parameter.getParameterizedType(), values[index]);
            if (values[index] == null && parameter.getType().isPrimitive()) {
                throw new IllegalArgumentException(
                        "%s argument '%s' is primitive and cannot be null"
                                .formatted(
                                        Signature.describe(executable),
                                        parameters[index].getName()));
            }
        }
        return values;
    }

    /**
     * Binds and invokes. Exceptions thrown by the method body are rethrown as they are, not
     * wrapped in {@link InvocationTargetException}.
     */
    static Object invoke(Method method, @Nullable Object receiver, Arguments args)
            throws Exception {
        Object[] values = bind(method, args);
        try {
            return method.invoke(receiver, values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
