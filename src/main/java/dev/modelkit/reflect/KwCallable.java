package dev.modelkit.reflect;

import javax.annotation.Nullable;

/**
 * Something that can be called with positional and keyword {@link Arguments}.
 *
 * <p>A plain lambda is opaque: it can be called but its parameter list cannot be inspected. To be
 * inspectable a callable also implements {@link Introspectable}, as {@link ReflectiveFunction}
 * and {@link DeclaredFunction} do.
 */
@FunctionalInterface
public interface KwCallable {
    Object call(Arguments args) throws Exception;

    default String name() {
        return getClass().getSimpleName();
    }

    @Nullable
    default String doc() {
        return null;
    }

    /**
     * Whether this is an unbound function. When such a callable is installed on a class and
     * called through an instance, the instance is passed as the first positional argument.
     */
    default boolean isPlainFunction() {
        return false;
    }

    /** The class this callable's code comes from. */
    default Class<?> origin() {
        return getClass();
    }
}
