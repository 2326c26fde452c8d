package dev.modelkit.tracking;

import dev.modelkit.reflect.KwCallable;
import dev.modelkit.reflect.ReflectiveFunction;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Patches installed on registered classes, keyed by the original class. A patch behaves like a
 * method assigned on that class: subclasses see it unless they declare their own method of the
 * same name.
 */
final class PatchedMethods {
    private static final Map<Class<?>, Map<String, KwCallable>> PATCHES =
            new ConcurrentHashMap<>();

    private PatchedMethods() {}

    static void put(Class<?> type, String name, KwCallable patch) {
        PATCHES.computeIfAbsent(type, t -> new ConcurrentHashMap<>()).put(name, patch);
    }

    static Optional<KwCallable> remove(Class<?> type, String name) {
        Map<String, KwCallable> patches = PATCHES.get(type);
        return Optional.ofNullable(patches == null ? null : patches.remove(name));
    }

    /**
     * Walks from {@code type} up to the class that declares method {@code name} (or to the top of
     * the hierarchy when none does) and returns the first patch found.
     */
    static Optional<KwCallable> resolve(Class<?> type, String name) {
        Class<?> declaring =
                ReflectiveFunction.findMethod(type, name, false)
                        .<Class<?>>map(Method::getDeclaringClass)
                        .orElse(Object.class);
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            Map<String, KwCallable> patches = PATCHES.get(c);
            KwCallable patch = patches == null ? null : patches.get(name);
            if (patch != null) {
                return Optional.of(patch);
            }
            if (c == declaring) {
                break;
            }
        }
        return Optional.empty();
    }
}
