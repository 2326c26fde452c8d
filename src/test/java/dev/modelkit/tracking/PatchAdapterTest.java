package dev.modelkit.tracking;

import static org.junit.jupiter.api.Assertions.*;

import dev.modelkit.config.ModelKitConfig;
import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.DeclaredFunction;
import dev.modelkit.reflect.Introspectable;
import dev.modelkit.reflect.KwCallable;
import dev.modelkit.reflect.ReflectionException;
import dev.modelkit.reflect.Signature;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PatchAdapterTest {
    private final List<PatchDiagnostic> diagnostics = new ArrayList<>();
    private final List<Arguments> received = new ArrayList<>();
    private PatchAdapter adapter;

    private final KwCallable canonical =
            DeclaredFunction.of(
                    "forward",
                    Signature.builder()
                            .parameter("self")
                            .parameter("x")
                            .parameter("outputAttentions", false)
                            .parameter("returnDict", false)
                            .build(),
                    args -> "canonical");

    @BeforeEach
    void setUp() {
        adapter = new PatchAdapter(diagnostics::add);
    }

    /** Public so its simple name is stable; the suffix marks it as a compiled dispatch object. */
    public static class TracedStaticFunction implements KwCallable {
        @Override
        public Object call(Arguments args) {
            return "traced";
        }
    }

    private DeclaredFunction patch(Signature.Builder signature) {
        return DeclaredFunction.of(
                        "forward",
                        signature.build(),
                        args -> {
                            received.add(args);
                            return "patched";
                        })
                .withDoc("a patch written against an older forward");
    }

    @Test
    void compatibleReplacementIsReturnedAsIs() {
        var superset =
                patch(
                        Signature.builder()
                                .parameter("self")
                                .parameter("x")
                                .parameter("outputHiddenStates", false)
                                .parameter("outputAttentions", false)
                                .parameter("returnDict", false));

        assertSame(superset, adapter.adapt(canonical, superset, PatchAdapterTest.class));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void missingExtensionParameterIsDroppedFromCalls() throws Exception {
        var stale =
                patch(
                        Signature.builder()
                                .parameter("self")
                                .parameter("x")
                                .parameter("returnDict", false));
        Object instance = new Object();

        KwCallable wrapped = adapter.adapt(canonical, stale, PatchAdapterTest.class);

        assertNotSame(stale, wrapped);
        assertEquals(List.of("outputAttentions"), ((AdaptedPatch) wrapped).strippedParameters());
        assertEquals(
                "patched", wrapped.call(Arguments.of(instance, 5).with("outputAttentions", true)));
        assertEquals(Arguments.of(instance, 5), received.get(0));

        assertEquals("patched", wrapped.call(Arguments.of(instance, 5).with("returnDict", true)));
        assertEquals(Arguments.of(instance, 5).with("returnDict", true), received.get(1));
    }

    @Test
    void wrapperKeepsTheIdentityOfThePatch() {
        var stale = patch(Signature.builder().parameter("self").parameter("x"));

        KwCallable wrapped = adapter.adapt(canonical, stale, PatchAdapterTest.class);

        assertEquals("forward", wrapped.name());
        assertEquals("a patch written against an older forward", wrapped.doc());
        assertSame(stale, ((AdaptedPatch) wrapped).wrapped());
        assertEquals(stale.signature(), ((Introspectable) wrapped).signature());
        assertTrue(wrapped.isPlainFunction());
    }

    @Test
    void diagnosticNamesTheMissingParameters() {
        var stale = patch(Signature.builder().parameter("self").parameter("x"));

        adapter.adapt(canonical, stale, PatchAdapterTest.class);

        assertEquals(1, diagnostics.size());
        PatchDiagnostic diagnostic = diagnostics.get(0);
        assertEquals(List.of("outputAttentions", "returnDict"), diagnostic.missing());
        assertEquals(PatchAdapterTest.class.getName(), diagnostic.owner());
        assertTrue(diagnostic.sameLibrary());
        assertTrue(diagnostic.message().contains("[outputAttentions, returnDict]"));
    }

    @Test
    void sameLibraryComparesLeadingPackageSegments() {
        assertTrue(PatchAdapter.sameLibrary(PatchAdapter.class, Signature.class));
        assertFalse(PatchAdapter.sameLibrary(PatchAdapter.class, String.class));
    }

    @Test
    void reAdaptingAnAdaptedPatchDropsTheSameNames() throws Exception {
        var stale = patch(Signature.builder().parameter("self").parameter("x"));

        KwCallable once = adapter.adapt(canonical, stale, PatchAdapterTest.class);
        KwCallable twice = adapter.adapt(canonical, once, PatchAdapterTest.class);

        assertNotSame(once, twice);
        assertEquals(
                ((AdaptedPatch) once).strippedParameters(),
                ((AdaptedPatch) twice).strippedParameters());
        twice.call(Arguments.of("self", 1).with("outputAttentions", true).with("returnDict", true));
        assertEquals(Arguments.of("self", 1), received.get(0));
    }

    @Test
    void compiledDispatchObjectsAreNeverInspected() {
        var traced = new TracedStaticFunction();

        assertSame(traced, adapter.adapt(canonical, traced, PatchAdapterTest.class));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void opaqueReplacementIsAReflectionError() {
        KwCallable opaque = args -> "opaque";

        assertThrows(
                ReflectionException.class,
                () -> adapter.adapt(canonical, opaque, PatchAdapterTest.class));
    }

    @Test
    void trackedOwnerIsBoundForPlainFunctions() throws Exception {
        var stale = patch(Signature.builder().parameter("self").parameter("x"));
        var owner = new TrackedOwner();

        KwCallable wrapped = adapter.adapt(canonical, stale, owner);

        wrapped.call(Arguments.of(3).with("returnDict", true));
        assertEquals(Arguments.of(owner, 3), received.get(0));
        assertFalse(wrapped.isPlainFunction(), "the owner is already bound");
    }

    @Test
    void debugConfigurationLogsTheInstallingStack() throws Exception {
        assertSame(
                PatchAdapter.LOG_WARNING,
                PatchAdapter.defaultSink(ModelKitConfig.of("MODELKIT_DEBUG", "false")));
        assertSame(
                PatchAdapter.LOG_WARNING_WITH_SITE,
                PatchAdapter.defaultSink(ModelKitConfig.of("MODELKIT_DEBUG", "true")));

        var debugAdapter = new PatchAdapter(ModelKitConfig.of("MODELKIT_DEBUG", "true"));
        var stale = patch(Signature.builder().parameter("self").parameter("x"));
        KwCallable wrapped = debugAdapter.adapt(canonical, stale, PatchAdapterTest.class);

        assertEquals("patched", wrapped.call(Arguments.of("self", 1).with("returnDict", true)));
    }

    static class TrackedOwner implements ConfigTracked {
        private InitConfig initConfig;

        @Override
        public InitConfig getInitConfig() {
            return initConfig;
        }

        @Override
        public void setInitConfig(InitConfig initConfig) {
            this.initConfig = initConfig;
        }
    }
}
