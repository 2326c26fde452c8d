package dev.modelkit.tracking;

import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.Signature;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds configuration records from call arguments. */
public final class ConfigCapture {
    private ConfigCapture() {}

    /**
     * Merges a call's arguments into one mapping from parameter name to effective value.
     *
     * <p>Layers, lowest precedence first: positional values zipped against the parameter names,
     * declared defaults of parameters the positional layer did not cover, keyword arguments. A
     * keyword therefore replaces a positional value for the same name; such a call would be
     * rejected by the callable itself and is not checked here.
     */
    public static Map<String, Object> fnArgsToDict(Signature signature, Arguments args) {
        List<String> names = signature.parameterNames();
        List<Object> positional = args.positional();

        var result = new LinkedHashMap<String, Object>();
        for (int i = 0; i < Math.min(names.size(), positional.size()); i++) {
            result.put(names.get(i), positional.get(i));
        }
        var keywordLayer = new LinkedHashMap<String, Object>();
        signature
                .defaults()
                .forEach(
                        (name, value) -> {
                            if (!result.containsKey(name)) {
                                keywordLayer.put(name, value);
                            }
                        });
        keywordLayer.putAll(args.keywords());
        result.putAll(keywordLayer);
        return result;
    }

    /** {@link #fnArgsToDict} plus the reserved raw-positional and class-name entries. */
    public static InitConfig buildConfig(Signature signature, Arguments args, String className) {
        var values = fnArgsToDict(signature, args);
        return withReservedEntries(values, args, className);
    }

    /**
     * The record stored on a constructed instance. Only keyword arguments are named; positional
     * arguments are kept verbatim under {@link InitConfig#INIT_ARGS} and are not resolved to
     * parameter names.
     */
    static InitConfig captureInit(Arguments args, String className) {
        return withReservedEntries(new LinkedHashMap<>(args.keywords()), args, className);
    }

    private static InitConfig withReservedEntries(
            Map<String, Object> values, Arguments args, String className) {
        if (!args.positional().isEmpty()) {
            values.put(InitConfig.INIT_ARGS, args.positional());
        }
        values.put(InitConfig.INIT_CLASS, className);
        return new InitConfig(values);
    }
}
