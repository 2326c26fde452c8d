package dev.modelkit.reflect;

import java.lang.reflect.Executable;

/** Signature lookups over callables. Nothing is cached; every call reflects afresh. */
public final class Signatures {
    private Signatures() {}

    /**
     * Reads the signature of a callable.
     *
     * @throws ReflectionException if the callable is opaque
     */
    public static Signature of(KwCallable callable) {
        if (callable instanceof Introspectable introspectable) {
            return introspectable.signature();
        }
        throw new ReflectionException(
                "cannot read the parameters of opaque callable " + callable.name());
    }

    /** Whether {@code name} is one of the callable's named (non-variadic) parameters. */
    public static boolean paramInFunc(KwCallable callable, String name) {
        return of(callable).hasParameter(name);
    }

    /** Whether {@code name} is a named (non-variadic) parameter of a method or constructor. */
    public static boolean paramInFunc(Executable executable, String name) {
        return Signature.of(executable).hasParameter(name);
    }
}
