package dev.modelkit.tracking;

import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.ReflectiveFunction;
import dev.modelkit.reflect.Signature;
import java.lang.reflect.Method;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The original, untracked initializer of a class. Hooks receive it so they can look at its
 * signature; calling it does not capture anything.
 */
public final class Initializer {
    private static final Signature NO_PARAMETERS = Signature.builder().build();

    @Nullable private final Method method;

    private Initializer(@Nullable Method method) {
        this.method = method;
    }

    static Initializer of(Method method) {
        return new Initializer(method);
    }

    /** The initializer of a class that declares and inherits none: it accepts no arguments. */
    static Initializer none() {
        return new Initializer(null);
    }

    public Optional<Method> method() {
        return Optional.ofNullable(method);
    }

    public Signature signature() {
        return method == null ? NO_PARAMETERS : Signature.of(method);
    }

    public void invoke(Object instance, Arguments args) throws Exception {
        if (method == null) {
            if (!args.positional().isEmpty() || !args.keywords().isEmpty()) {
                throw new IllegalArgumentException(
                        instance.getClass().getSimpleName() + " takes no arguments");
            }
            return;
        }
        ReflectiveFunction.bound(instance, method).call(args);
    }

    @Override
    public String toString() {
        if (method == null) {
            return "initializer <none>";
        }
        return "initializer %s.%s"
                .formatted(method.getDeclaringClass().getSimpleName(), method.getName());
    }
}
