package dev.modelkit.tracking;

import dev.modelkit.config.ModelKitConfig;
import dev.modelkit.reflect.KwCallable;
import dev.modelkit.reflect.Signature;
import dev.modelkit.reflect.Signatures;
import java.lang.reflect.Method;
import java.util.Objects;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Makes replacements of the dispatch method callable with the canonical method's arguments.
 *
 * <p>Compatibility is decided from parameter names alone: a replacement that lacks some of the
 * {@link ExtensionParameters} the canonical method declares is wrapped in an {@link AdaptedPatch}
 * that drops them. Nothing is remembered between calls; re-adapting an adapted patch wraps it
 * again and drops the same names.
 */
@Slf4j
public final class PatchAdapter {
    /** Compiled dispatch objects are recognised by this class-name suffix and never wrapped. */
    static final String OPAQUE_DISPATCH_SUFFIX = "StaticFunction";

    static final DiagnosticSink LOG_WARNING = d -> log.warn(d.message());

    /** Also logs the stack of the code that installed the patch. */
    static final DiagnosticSink LOG_WARNING_WITH_SITE =
            d -> log.warn(d.message(), new PatchInstallSite(d.owner()));

    private final DiagnosticSink diagnostics;

    /** Reports diagnostics through the default sink of the environment's configuration. */
    public PatchAdapter() {
        this(ModelKitConfig.fromEnvironment());
    }

    public PatchAdapter(ModelKitConfig config) {
        this(defaultSink(config));
    }

    public PatchAdapter(DiagnosticSink diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics);
    }

    /**
     * Adapts {@code replacement} to the signature of {@code canonical}.
     *
     * @param owner what is being patched. When it is a tracked instance and the replacement is a
     *     plain function, the wrapper binds the instance as first argument.
     * @return {@code replacement} itself when no adaptation is needed, otherwise a wrapper
     * @throws dev.modelkit.reflect.ReflectionException if either signature cannot be read
     */
    public KwCallable adapt(KwCallable canonical, KwCallable replacement, @Nullable Object owner) {
        return adapt(() -> Signatures.of(canonical), canonical.origin(), replacement, owner);
    }

    public KwCallable adapt(Method canonical, KwCallable replacement, @Nullable Object owner) {
        return adapt(
                () -> Signature.of(canonical), canonical.getDeclaringClass(), replacement, owner);
    }

    private KwCallable adapt(
            Supplier<Signature> canonicalSignature,
            Class<?> canonicalOrigin,
            KwCallable replacement,
            @Nullable Object owner) {
        if (replacement.getClass().getSimpleName().endsWith(OPAQUE_DISPATCH_SUFFIX)) {
            return replacement;
        }
        Signature replacementSignature = Signatures.of(replacement);
        PatchAdaptation adaptation =
                PatchAdaptation.between(canonicalSignature.get(), replacementSignature);
        if (adaptation.isCompatible()) {
            return replacement;
        }

        diagnostics.emit(
                new PatchDiagnostic(
                        describe(owner),
                        adaptation.missing(),
                        sameLibrary(canonicalOrigin, replacement.origin())));

        boolean bindOwner = owner instanceof ConfigTracked && replacement.isPlainFunction();
        return new AdaptedPatch(replacement, adaptation.missing(), bindOwner ? owner : null);
    }

    /** Warnings only, or warnings with the installing stack when {@code debug} is set. */
    static DiagnosticSink defaultSink(ModelKitConfig config) {
        return config.debug() ? LOG_WARNING_WITH_SITE : LOG_WARNING;
    }

    /** Carries the stack of a patch installation into the log; never thrown. */
    static final class PatchInstallSite extends Exception {
        PatchInstallSite(String owner) {
            super("patch of " + owner + " installed here");
        }
    }

    /** Two classes belong to the same library when their first two package segments agree. */
    static boolean sameLibrary(Class<?> a, Class<?> b) {
        return libraryOf(a).equals(libraryOf(b));
    }

    private static String libraryOf(Class<?> type) {
        String[] segments = type.getPackageName().split("\\.");
        return segments.length < 2 ? segments[0] : segments[0] + "." + segments[1];
    }

    private static String describe(@Nullable Object owner) {
        if (owner instanceof Class<?> type) {
            return type.getName();
        }
        return String.valueOf(owner);
    }
}
