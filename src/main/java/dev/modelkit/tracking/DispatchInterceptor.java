package dev.modelkit.tracking;

import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.DefaultValue;
import dev.modelkit.reflect.KeywordArgs;
import dev.modelkit.reflect.KwCallable;
import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import net.bytebuddy.implementation.bind.annotation.AllArguments;
import net.bytebuddy.implementation.bind.annotation.Origin;
import net.bytebuddy.implementation.bind.annotation.RuntimeType;
import net.bytebuddy.implementation.bind.annotation.SuperCall;
import net.bytebuddy.implementation.bind.annotation.This;

/**
 * Delegation target for the dispatch method of generated subclasses. Runs the installed patch if
 * there is one, otherwise the original method.
 *
 * <p>Must stay public: generated classes live in their own class loader.
 */
public class DispatchInterceptor {
    private final TrackedClass<?> owner;

    DispatchInterceptor(TrackedClass<?> owner) {
        this.owner = owner;
    }

    @RuntimeType
    public Object dispatch(
            @This Object self,
            @Origin Method method,
            @AllArguments Object[] args,
            @SuperCall Callable<?> zuper)
            throws Exception {
        Optional<KwCallable> patch = owner.patchedMethod(method.getName());
        if (patch.isEmpty()) {
            return zuper.call();
        }
        Method declared = owner.declaredMethod(method).orElse(method);
        return owner.callPatch(patch.get(), self, toArguments(declared, args));
    }

    /**
     * Converts a Java call into positional and keyword arguments. Parameters up to the first one
     * with a declared default go positionally, the rest by keyword, unless the method is varargs,
     * in which case everything named goes positionally so the surplus still lines up.
     */
    private static Arguments toArguments(Method method, Object[] args) {
        Parameter[] parameters = method.getParameters();
        List<Object> positional = new ArrayList<>();
        Map<String, Object> keywords = new LinkedHashMap<>();
        boolean byKeyword = false;
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            if (method.isVarArgs() && i == parameters.length - 1) {
                Object packed = args[i];
                for (int j = 0; packed != null && j < Array.getLength(packed); j++) {
                    positional.add(Array.get(packed, j));
                }
            } else if (parameter.isAnnotationPresent(KeywordArgs.class)) {
                if (args[i] instanceof Map<?, ?> extra) {
                    extra.forEach((k, v) -> keywords.put(String.valueOf(k), v));
                }
            } else {
                byKeyword |=
                        !method.isVarArgs() && parameter.isAnnotationPresent(DefaultValue.class);
                if (byKeyword) {
                    keywords.put(parameter.getName(), args[i]);
                } else {
                    positional.add(args[i]);
                }
            }
        }
        return Arguments.of(positional, keywords);
    }
}
