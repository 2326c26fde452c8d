package dev.modelkit.tracking;

import static net.bytebuddy.matcher.ElementMatchers.isFinal;
import static net.bytebuddy.matcher.ElementMatchers.isStatic;
import static net.bytebuddy.matcher.ElementMatchers.named;
import static net.bytebuddy.matcher.ElementMatchers.not;

import dev.modelkit.reflect.ArgumentTypes;
import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.KwCallable;
import dev.modelkit.reflect.ReflectiveFunction;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.description.modifier.Visibility;
import net.bytebuddy.implementation.FieldAccessor;
import net.bytebuddy.implementation.MethodDelegation;

/**
 * A class registered with {@link InitTracker}. Construction through this object runs the
 * pre-init hook, the original initializer and the post-init hook, then stores an
 * {@link InitConfig} on the new instance.
 *
 * <p>Instances are built from a ByteBuddy subclass of the registered class which carries the
 * record and routes calls of the dispatch method to the patch installed with {@link
 * #setPatchedMethod}, if any.
 */
@Slf4j
public final class TrackedClass<T> {
    private static final String CONFIG_FIELD = "initConfig";

    private final Class<T> type;
    private final Initializer initializer;
    @Nullable private final Method preInit;
    @Nullable private final Method postInit;
    private final PatchAdapter patchAdapter;
    private final Class<? extends T> trackedType;

    TrackedClass(
            Class<T> type,
            Initializer initializer,
            @Nullable Method preInit,
            @Nullable Method postInit,
            PatchAdapter patchAdapter) {
        this.type = type;
        this.initializer = initializer;
        this.preInit = preInit;
        this.postInit = postInit;
        this.patchAdapter = patchAdapter;
        this.trackedType = define(type, new DispatchInterceptor(this));
    }

    private static <T> Class<? extends T> define(Class<T> type, DispatchInterceptor interceptor) {
        return new ByteBuddy()
                .subclass(type)
                .defineField(CONFIG_FIELD, InitConfig.class, Visibility.PRIVATE)
                .implement(ConfigTracked.class)
                .intercept(FieldAccessor.ofBeanProperty())
                .method(
                        named(InitTracker.DISPATCH_METHOD)
                                .and(not(isStatic()))
                                .and(not(isFinal())))
                .intercept(MethodDelegation.to(interceptor))
                .make()
                .load(type.getClassLoader())
                .getLoaded();
    }

    public Class<T> type() {
        return type;
    }

    /** The generated subclass every instance of this tracked class belongs to. */
    public Class<? extends T> trackedType() {
        return trackedType;
    }

    public Initializer initializer() {
        return initializer;
    }

    /** Builds an instance from positional arguments only. */
    public T newInstance(Object... positional) {
        return newInstance(Arguments.of(positional));
    }

    /**
     * Allocates and initializes an instance. Whatever the initializer or a hook throws propagates
     * unchanged.
     */
    public T newInstance(Arguments args) {
        T instance = allocate();
        initialize(instance, args);
        return instance;
    }

    /**
     * Rebuilds an instance from a captured record: its raw positional arguments and its named
     * values become the positional and keyword arguments of a new construction. Values are first
     * converted to the initializer's parameter types, since a record read from JSON only holds
     * JSON numbers, strings, lists and maps.
     */
    public T newInstance(InitConfig config) {
        config.initClass()
                .filter(name -> !name.equals(type.getSimpleName()))
                .ifPresent(
                        name ->
                                log.warn(
                                        "config captured from {} is used to build {}",
                                        name,
                                        type.getSimpleName()));
        Arguments args = Arguments.of(config.initArgs(), config.namedValues());
        Optional<Method> init = initializer.method();
        return newInstance(init.isPresent() ? ArgumentTypes.convert(init.get(), args) : args);
    }

    /** Creates an instance with the no-arg constructor; it has no record until initialized. */
    public T allocate() {
        try {
            Constructor<? extends T> constructor = trackedType.getDeclaredConstructor();
            constructor.trySetAccessible();
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new IllegalStateException(
                    "constructor of " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("cannot allocate " + type.getName(), e);
        }
    }

    /**
     * Runs the tracked initialization on an allocated instance. The record is attached only after
     * the initializer and the post-init hook have returned; if either throws, no record exists.
     */
    @SneakyThrows
    public void initialize(@Nonnull T instance, @Nonnull Arguments args) {
        if (!trackedType.isInstance(instance)) {
            throw new IllegalArgumentException(
                    "%s was not allocated by %s".formatted(instance, this));
        }
        if (preInit != null) {
            invokeHook(preInit, instance, args);
        }
        initializer.invoke(instance, args);
        if (postInit != null) {
            invokeHook(postInit, instance, args);
        }
        ((ConfigTracked) instance)
                .setInitConfig(ConfigCapture.captureInit(args, type.getSimpleName()));
    }

    private void invokeHook(Method hook, Object instance, Arguments args) throws Exception {
        try {
            hook.invoke(instance, initializer, args);
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

    /**
     * Assigns a method on this class. An assignment of the dispatch method is first passed
     * through the {@link PatchAdapter} against the class's declared dispatch method; anything else
     * is stored as given.
     */
    public void setPatchedMethod(@Nonnull String name, @Nonnull KwCallable value) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(value);
        KwCallable stored = value;
        if (InitTracker.DISPATCH_METHOD.equals(name)) {
            Optional<Method> canonical = canonicalMethod();
            if (canonical.isPresent()) {
                stored = patchAdapter.adapt(canonical.get(), value, this);
            } else {
                log.debug("{} declares no {} method, storing patch as is", type, name);
            }
        }
        PatchedMethods.put(type, name, stored);
        log.debug("patched {}.{} with {}", type.getSimpleName(), name, stored);
    }

    /** Removes the patch installed on this class itself under {@code name}, if any. */
    public Optional<KwCallable> removePatchedMethod(@Nonnull String name) {
        Optional<KwCallable> removed = PatchedMethods.remove(type, name);
        removed.ifPresent(patch -> log.debug("unpatched {}.{}", type.getSimpleName(), name));
        return removed;
    }

    /**
     * The patch in effect for {@code name} on this class: its own, or else the nearest one
     * installed on a superclass, as long as no class in between declares its own method of that
     * name.
     */
    public Optional<KwCallable> patchedMethod(String name) {
        return PatchedMethods.resolve(type, name);
    }

    /** The dispatch method as the registered class declares it. */
    public Optional<Method> canonicalMethod() {
        return ReflectiveFunction.findMethod(type, InitTracker.DISPATCH_METHOD, false);
    }

    /**
     * Calls method {@code name} on an instance with explicit keyword arguments: the patch
     * installed under that name if there is one, otherwise the class's own method.
     */
    public Object invoke(@Nonnull T instance, @Nonnull String name, @Nonnull Arguments args)
            throws Exception {
        Optional<KwCallable> patch = patchedMethod(name);
        if (patch.isPresent()) {
            return callPatch(patch.get(), instance, args);
        }
        Method method =
                ReflectiveFunction.findMethod(type, name, false)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "no method %s on %s"
                                                        .formatted(name, type.getName())));
        return ReflectiveFunction.bound(instance, method).call(args);
    }

    Object callPatch(KwCallable patch, Object instance, Arguments args) throws Exception {
        return patch.call(patch.isPlainFunction() ? args.prepend(instance) : args);
    }

    /** The registered class's declaration of an intercepted method, which carries its metadata. */
    Optional<Method> declaredMethod(Method intercepted) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Optional<Method> found =
                    Arrays.stream(c.getDeclaredMethods())
                            .filter(m -> m.getName().equals(intercepted.getName()))
                            .filter(
                                    m ->
                                            Arrays.equals(
                                                    m.getParameterTypes(),
                                                    intercepted.getParameterTypes()))
                            .findFirst();
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "TrackedClass[" + type.getName() + "]";
    }
}
