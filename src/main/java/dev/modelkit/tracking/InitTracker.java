package dev.modelkit.tracking;

import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.KwCallable;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Registers classes for construction tracking.
 *
 * <p>Tracking needs no cooperation from the class beyond two-phase construction: an accessible
 * no-arg constructor, and an instance method annotated {@link Init} receiving the configuration.
 * A class may also declare hook methods
 *
 * <pre>{@code
 * void preInit(Initializer originalInit, Arguments args)
 * void postInit(Initializer originalInit, Arguments args)
 * }</pre>
 *
 * which run right before and right after the initializer.
 */
@Slf4j
public final class InitTracker {
    /** Name of the canonical dispatch method, the one whose patches are adapted. */
    public static final String DISPATCH_METHOD = "forward";

    static final String PRE_INIT_HOOK = "preInit";
    static final String POST_INIT_HOOK = "postInit";

    private InitTracker() {}

    public static <T> TrackedClass<T> track(@Nonnull Class<T> type) {
        return track(type, new PatchAdapter());
    }

    /**
     * Registers {@code type}. Only an initializer the class declares itself is looked up together
     * with the hooks; a class without one runs the initializer and hooks of the nearest ancestor
     * that declares an initializer.
     *
     * @throws IllegalArgumentException if the class cannot be subclassed and allocated
     */
    public static <T> TrackedClass<T> track(
            @Nonnull Class<T> type, @Nonnull PatchAdapter patchAdapter) {
        checkTrackable(type);

        Initializer initializer = Initializer.none();
        Method preInit = null;
        Method postInit = null;
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Optional<Method> declared = declaredInitializer(c);
            if (declared.isPresent()) {
                initializer = Initializer.of(declared.get());
                preInit = findHook(c, PRE_INIT_HOOK);
                postInit = findHook(c, POST_INIT_HOOK);
                break;
            }
        }
        log.debug(
                "tracking {} with {} (preInit: {}, postInit: {})",
                type.getName(),
                initializer,
                preInit != null,
                postInit != null);
        return new TrackedClass<>(type, initializer, preInit, postInit, patchAdapter);
    }

    /** Assigns {@code name} on a tracked class; see {@link TrackedClass#setPatchedMethod}. */
    public static void setPatchedMethod(
            @Nonnull TrackedClass<?> trackedClass,
            @Nonnull String name,
            @Nonnull KwCallable callable) {
        trackedClass.setPatchedMethod(name, callable);
    }

    public static boolean isTracked(@Nullable Object instance) {
        return instance instanceof ConfigTracked;
    }

    /** The record of a tracked instance; empty for untracked objects or unfinished construction. */
    public static Optional<InitConfig> initConfigOf(@Nullable Object instance) {
        if (instance instanceof ConfigTracked tracked) {
            return Optional.ofNullable(tracked.getInitConfig());
        }
        return Optional.empty();
    }

    private static void checkTrackable(Class<?> type) {
        int modifiers = type.getModifiers();
        if (type.isInterface()
                || type.isPrimitive()
                || type.isArray()
                || Modifier.isFinal(modifiers)
                || Modifier.isAbstract(modifiers)) {
            throw new IllegalArgumentException(
                    "cannot track %s: not a concrete, non-final class".formatted(type.getName()));
        }
        if (!Modifier.isPublic(modifiers)) {
            throw new IllegalArgumentException(
                    "cannot track %s: class is not public".formatted(type.getName()));
        }
        boolean allocatable =
                Arrays.stream(type.getDeclaredConstructors())
                        .filter(c -> c.getParameterCount() == 0)
                        .map(Constructor::getModifiers)
                        .anyMatch(m -> Modifier.isPublic(m) || Modifier.isProtected(m));
        if (!allocatable) {
            throw new IllegalArgumentException(
                    "cannot track %s: no public or protected no-arg constructor"
                            .formatted(type.getName()));
        }
    }

    private static Optional<Method> declaredInitializer(Class<?> type) {
        List<Method> initializers =
                Arrays.stream(type.getDeclaredMethods())
                        .filter(m -> m.isAnnotationPresent(Init.class))
                        .toList();
        if (initializers.size() > 1) {
            throw new IllegalArgumentException(
                    "%s declares %d @Init methods, expected at most one"
                            .formatted(type.getName(), initializers.size()));
        }
        if (initializers.isEmpty()) {
            return Optional.empty();
        }
        Method initializer = initializers.get(0);
        if (Modifier.isStatic(initializer.getModifiers())) {
            throw new IllegalArgumentException(
                    "@Init method %s.%s must not be static"
                            .formatted(type.getName(), initializer.getName()));
        }
        return Optional.of(initializer);
    }

    @Nullable
    private static Method findHook(Class<?> type, String name) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Optional<Method> hook =
                    Arrays.stream(c.getDeclaredMethods())
                            .filter(m -> m.getName().equals(name))
                            .filter(m -> !Modifier.isStatic(m.getModifiers()))
                            .filter(
                                    m ->
                                            Arrays.equals(
                                                    m.getParameterTypes(),
                                                    new Class<?>[] {
                                                        Initializer.class, Arguments.class
                                                    }))
                            .findFirst();
            if (hook.isPresent()) {
                hook.get().trySetAccessible();
                return hook.get();
            }
        }
        return null;
    }
}
