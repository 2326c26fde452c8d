package dev.modelkit.tracking;

import static org.junit.jupiter.api.Assertions.*;

import dev.modelkit.reflect.Arguments;
import dev.modelkit.reflect.Signature;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigCaptureTest {
    private static final Signature ABC =
            Signature.builder().parameter("a").parameter("b", 2).parameter("c", 3).build();

    @Test
    void keywordWinsOverDefaultAndPositionalFillsLeadingNames() {
        InitConfig config = ConfigCapture.buildConfig(ABC, Arguments.of(1).with("c", 9), "M");

        assertEquals(Map.of("a", 1, "b", 2, "c", 9), config.namedValues());
        assertEquals(List.of(1), config.initArgs());
        assertEquals("M", config.initClass().orElseThrow());
    }

    @Test
    void mergeFollowsLayerPrecedenceForEverySplit() {
        var names = List.of("p", "q", "r", "s");
        var signature =
                Signature.builder()
                        .parameter("p")
                        .parameter("q")
                        .parameter("r", "r-default")
                        .parameter("s", "s-default")
                        .build();
        List<Map<String, Object>> keywordSets =
                List.of(Map.of(), Map.of("s", "kw-s"), Map.of("r", "kw-r", "q", "kw-q"));

        for (int p = 0; p <= names.size(); p++) {
            List<Object> positional =
                    names.subList(0, p).stream().map(n -> (Object) ("pos-" + n)).toList();
            for (Map<String, Object> keywords : keywordSets) {
                Map<String, Object> merged =
                        ConfigCapture.fnArgsToDict(signature, Arguments.of(positional, keywords));

                var expected = new LinkedHashMap<String, Object>();
                for (int i = 0; i < p; i++) {
                    expected.put(names.get(i), "pos-" + names.get(i));
                }
                for (String name : List.of("r", "s")) {
                    if (!expected.containsKey(name)) {
                        expected.put(name, name + "-default");
                    }
                }
                expected.putAll(keywords);
                assertEquals(expected, merged, "p=" + p + " keywords=" + keywords);
            }
        }
    }

    @Test
    void keywordSilentlyReplacesPositionalValueForTheSameName() {
        Map<String, Object> merged =
                ConfigCapture.fnArgsToDict(ABC, Arguments.of(1, 5).with("b", 7));

        assertEquals(Map.of("a", 1, "b", 7, "c", 3), merged);
    }

    @Test
    void surplusPositionalsAreOnlyKeptRaw() {
        InitConfig config = ConfigCapture.buildConfig(ABC, Arguments.of(1, 2, 3, 4), "M");

        assertEquals(Map.of("a", 1, "b", 2, "c", 3), config.namedValues());
        assertEquals(List.of(1, 2, 3, 4), config.initArgs());
    }

    @Test
    void constructionRecordNamesOnlyKeywordValues() {
        InitConfig config = ConfigCapture.captureInit(Arguments.of(1).with("c", 9), "M");

        assertEquals(
                List.of("c", InitConfig.INIT_ARGS, InitConfig.INIT_CLASS),
                List.copyOf(config.asMap().keySet()));
        assertEquals(9, config.get("c"));
        assertFalse(config.containsKey("a"));
        assertFalse(config.containsKey("b"));
        assertEquals(List.of(1), config.initArgs());
    }

    @Test
    void recordWithoutPositionalsHasNoRawEntry() {
        InitConfig config = ConfigCapture.captureInit(Arguments.ofKeywords(Map.of("a", 1)), "M");

        assertFalse(config.containsKey(InitConfig.INIT_ARGS));
        assertEquals(List.of(), config.initArgs());
        assertEquals(Map.of("a", 1, InitConfig.INIT_CLASS, "M"), config.asMap());
    }

    @Test
    void recordSurvivesJson() {
        InitConfig config = ConfigCapture.captureInit(Arguments.of(1, "x").with("c", 9), "M");

        InitConfig read = InitConfig.fromJson(config.toJson());

        assertEquals(config, read);
        assertEquals(List.of(1, "x"), read.initArgs());
    }
}
