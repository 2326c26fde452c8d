package dev.modelkit.reflect;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A callable backed by a Java method.
 *
 * <p>Built from a static method it is a plain function: a receiver, if any, is just its first
 * parameter. Built with {@link #bound(Object, Method)} it is a bound method and the receiver is
 * supplied by this object.
 */
public final class ReflectiveFunction implements KwCallable, Introspectable {
    private final Method method;
    @Nullable private final Object receiver;

    private ReflectiveFunction(Method method, @Nullable Object receiver) {
        this.method = method;
        this.receiver = receiver;
        method.trySetAccessible();
    }

    /** A plain function over a static method. */
    public static ReflectiveFunction of(@Nonnull Method method) {
        Objects.requireNonNull(method);
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException(
                    "%s is an instance method; use bound(receiver, method)"
                            .formatted(Signature.describe(method)));
        }
        return new ReflectiveFunction(method, null);
    }

    /** A plain function over the static method {@code name} of {@code owner}. */
    public static ReflectiveFunction of(@Nonnull Class<?> owner, @Nonnull String name) {
        return of(
                findMethod(owner, name, true)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "no static method %s on %s"
                                                        .formatted(name, owner.getName()))));
    }

    /** A bound method: calls go to {@code method} on {@code receiver}. */
    public static ReflectiveFunction bound(@Nonnull Object receiver, @Nonnull Method method) {
        Objects.requireNonNull(receiver);
        Objects.requireNonNull(method);
        if (Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException(
                    "%s is static; use of(method)".formatted(Signature.describe(method)));
        }
        if (!method.getDeclaringClass().isInstance(receiver)) {
            throw new IllegalArgumentException(
                    "%s cannot be bound to a %s"
                            .formatted(
                                    Signature.describe(method), receiver.getClass().getName()));
        }
        return new ReflectiveFunction(method, receiver);
    }

    public static ReflectiveFunction bound(@Nonnull Object receiver, @Nonnull String name) {
        return bound(
                receiver,
                findMethod(receiver.getClass(), name, false)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "no method %s on %s"
                                                        .formatted(
                                                                name,
                                                                receiver.getClass().getName()))));
    }

    /**
     * Finds the method named {@code name} on the nearest class of {@code type}'s hierarchy that
     * declares one. Among overloads in that class the one with the most parameters wins.
     */
    public static Optional<Method> findMethod(Class<?> type, String name, boolean isStatic) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Optional<Method> found =
                    Arrays.stream(c.getDeclaredMethods())
                            .filter(m -> m.getName().equals(name))
                            .filter(m -> !m.isSynthetic() && !m.isBridge())
                            .filter(m -> Modifier.isStatic(m.getModifiers()) == isStatic)
                            .max(Comparator.comparingInt(Method::getParameterCount));
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public Method method() {
        return method;
    }

    @Nullable
    public Object receiver() {
        return receiver;
    }

    @Override
    public Signature signature() {
        return Signature.of(method);
    }

    @Override
    public Object call(Arguments args) throws Exception {
        return ArgumentBinder.invoke(method, receiver, args);
    }

    @Override
    public String name() {
        return method.getName();
    }

    @Override
    public boolean isPlainFunction() {
        return receiver == null;
    }

    @Override
    public Class<?> origin() {
        return method.getDeclaringClass();
    }

    @Override
    public String toString() {
        return (receiver == null ? "function " : "bound method ") + Signature.describe(method);
    }
}
