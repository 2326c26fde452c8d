package dev.modelkit.reflect;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A plain function that states its own signature instead of having it read by reflection. This is
 * how a lambda becomes inspectable.
 */
public final class DeclaredFunction implements KwCallable, Introspectable {
    private final String name;
    @Nullable private final String doc;
    private final Signature signature;
    private final KwCallable body;

    private DeclaredFunction(
            String name, @Nullable String doc, Signature signature, KwCallable body) {
        this.name = Objects.requireNonNull(name);
        this.doc = doc;
        this.signature = Objects.requireNonNull(signature);
        this.body = Objects.requireNonNull(body);
    }

    public static DeclaredFunction of(String name, Signature signature, KwCallable body) {
        return new DeclaredFunction(name, null, signature, body);
    }

    public DeclaredFunction withDoc(@Nullable String doc) {
        return new DeclaredFunction(name, doc, signature, body);
    }

    @Override
    public Signature signature() {
        return signature;
    }

    @Override
    public Object call(Arguments args) throws Exception {
        return body.call(args);
    }

    @Override
    public String name() {
        return name;
    }

    @Nullable
    @Override
    public String doc() {
        return doc;
    }

    @Override
    public boolean isPlainFunction() {
        return true;
    }

    @Override
    public Class<?> origin() {
        return body.origin();
    }

    @Override
    public String toString() {
        return "function " + name;
    }
}
