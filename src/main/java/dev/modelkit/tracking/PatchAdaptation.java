package dev.modelkit.tracking;

import dev.modelkit.reflect.Signature;
import java.util.List;

/**
 * The extension parameters a canonical signature has and a replacement lacks, in
 * {@link ExtensionParameters#NAMES} order.
 */
public record PatchAdaptation(List<String> missing) {

    public PatchAdaptation {
        missing = List.copyOf(missing);
    }

    public static PatchAdaptation between(Signature canonical, Signature replacement) {
        return new PatchAdaptation(
                ExtensionParameters.NAMES.stream()
                        .filter(canonical::hasParameter)
                        .filter(name -> !replacement.hasParameter(name))
                        .toList());
    }

    public boolean isCompatible() {
        return missing.isEmpty();
    }
}
