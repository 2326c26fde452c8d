package dev.modelkit.reflect;

/** A callable whose parameter list can be read. */
public interface Introspectable {
    /**
     * Derives the signature. Implementations reflect on every call rather than caching, so a
     * result always describes the callable as it is now.
     *
     * @throws ReflectionException if the parameter list cannot be read
     */
    Signature signature();
}
