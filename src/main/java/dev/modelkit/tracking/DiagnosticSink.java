package dev.modelkit.tracking;

/** Receives patch diagnostics. These are warnings: the patch is installed regardless. */
@FunctionalInterface
public interface DiagnosticSink {
    void emit(PatchDiagnostic diagnostic);
}
