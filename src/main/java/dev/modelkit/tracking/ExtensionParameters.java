package dev.modelkit.tracking;

import java.util.List;

/**
 * Optional output-control parameters of the dispatch method. A patch may lack any of these and
 * still be usable: calls are adapted by dropping them.
 */
public final class ExtensionParameters {
    public static final String OUTPUT_HIDDEN_STATES = "outputHiddenStates";
    public static final String OUTPUT_ATTENTIONS = "outputAttentions";
    public static final String RETURN_DICT = "returnDict";

    public static final List<String> NAMES =
            List.of(OUTPUT_HIDDEN_STATES, OUTPUT_ATTENTIONS, RETURN_DICT);

    private ExtensionParameters() {}
}
