package dev.modelkit.reflect;

import javax.annotation.Nullable;

/**
 * Thrown when the signature of a callable cannot be derived: the callable is opaque, its class was
 * compiled without parameter names, or a declared default cannot be read.
 *
 * <p>This is a RuntimeException so it propagates to whoever asked for the signature; nothing in
 * modelkit recovers from it.
 */
public class ReflectionException extends RuntimeException {
    public ReflectionException(String message) {
        super(message);
    }

    public ReflectionException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
