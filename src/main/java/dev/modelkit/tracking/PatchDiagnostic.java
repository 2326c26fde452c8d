package dev.modelkit.tracking;

import java.util.List;

/**
 * Emitted when a patch of the dispatch method lacks extension parameters and has been wrapped.
 *
 * @param owner what was patched
 * @param missing the extension parameters the wrapper drops
 * @param sameLibrary whether the patch comes from the same library as the method it replaces
 */
public record PatchDiagnostic(String owner, List<String> missing, boolean sameLibrary) {

    public PatchDiagnostic {
        missing = List.copyOf(missing);
    }

    public String message() {
        if (sameLibrary) {
            return ("The `%s` method of %s is patched and the patch might be based on an old"
                            + " version which misses some arguments compared with the latest, such"
                            + " as %s. Compatibility for these arguments is added automatically,"
                            + " and maybe the patch should be updated.")
                    .formatted(InitTracker.DISPATCH_METHOD, owner, missing);
        }
        return ("The `%s` method of %s is patched and the patch might conflict with patches"
                        + " made by the library which seem to have more arguments, such as %s."
                        + " Compatibility for these arguments is added automatically, and maybe"
                        + " the patch should be updated.")
                .formatted(InitTracker.DISPATCH_METHOD, owner, missing);
    }
}
