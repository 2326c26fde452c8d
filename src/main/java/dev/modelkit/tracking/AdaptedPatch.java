package dev.modelkit.tracking;

import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.Introspectable;
import dev.modelkit.reflect.KwCallable;
import dev.modelkit.reflect.Signature;
import dev.modelkit.reflect.Signatures;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Wraps a patch that lacks some extension parameters: those keywords are dropped from every call
 * before the patch runs. Name, documentation and signature are the wrapped patch's.
 */
public final class AdaptedPatch implements KwCallable, Introspectable {
    private final KwCallable patch;
    private final List<String> stripped;
    @Nullable private final Object boundOwner;

    AdaptedPatch(KwCallable patch, List<String> stripped, @Nullable Object boundOwner) {
        this.patch = patch;
        this.stripped = List.copyOf(stripped);
        this.boundOwner = boundOwner;
    }

    @Override
    public Object call(Arguments args) throws Exception {
        Arguments filtered = args.withoutKeywords(stripped);
        if (boundOwner != null) {
            filtered = filtered.prepend(boundOwner);
        }
        return patch.call(filtered);
    }

    public KwCallable wrapped() {
        return patch;
    }

    public List<String> strippedParameters() {
        return stripped;
    }

    @Override
    public Signature signature() {
        return Signatures.of(patch);
    }

    @Override
    public String name() {
        return patch.name();
    }

    @Nullable
    @Override
    public String doc() {
        return patch.doc();
    }

    @Override
    public boolean isPlainFunction() {
        return boundOwner == null && patch.isPlainFunction();
    }

    @Override
    public Class<?> origin() {
        return patch.origin();
    }

    @Override
    public String toString() {
        return "adapted " + patch + " without " + stripped;
    }
}
