package dev.modelkit.config;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ModelKitConfigTest {
    @Test
    void modelHomeDefaultsUnderHome() {
        var config = ModelKitConfig.of("MODELKIT_HOME", "/opt/modelkit");
        assertEquals("/opt/modelkit", config.home());
        assertEquals(Path.of("/opt/modelkit", "models").toString(), config.modelHome());
    }

    @Test
    void overridesWinOverDefaults() {
        var config =
                ModelKitConfig.of(
                        "MODELKIT_MODEL_HOME", "/data/models",
                        "HUGGINGFACE_HUB_CACHE", "/data/hub",
                        "MODELKIT_DEBUG", "true");
        assertEquals("/data/models", config.modelHome());
        assertEquals("/data/hub", config.hfCacheHome());
        assertTrue(config.debug());
    }

    @Test
    void danglingOverrideKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ModelKitConfig.of("MODELKIT_HOME"));
    }

    @Test
    public void testBuilderEqualsEnv() {
        var fromEnv =
                ModelKitConfig.of(
                        "MODELKIT_HOME", "/tmp/mk",
                        "MODELKIT_TRANSFORMERS_PACKAGE", "com.acme.transformers");
        var fromBuilder =
                ModelKitConfig.builder()
                        .home("/tmp/mk")
                        .transformersPackage("com.acme.transformers")
                        .build();
        var otherBuilder =
                ModelKitConfig.builder()
                        .home("/tmp/other")
                        .transformersPackage("com.acme.transformers")
                        .build();
        assertEquals(fromEnv, fromBuilder);
        assertNotEquals(fromEnv, otherBuilder);
    }

    @Test
    public void testBuilderHasMethodForEveryField() {
        List<String> fieldsToSkip = List.of("envOverrides");
        Field[] configFields = ModelKitConfig.class.getDeclaredFields();

        Method[] builderMethods = ModelKitConfig.Builder.class.getDeclaredMethods();
        Set<String> builderMethodNames =
                Arrays.stream(builderMethods).map(Method::getName).collect(Collectors.toSet());

        for (Field field : configFields) {
            String configFieldName = field.getName();
            if (fieldsToSkip.contains(configFieldName)
                    || Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            assertTrue(
                    builderMethodNames.contains(configFieldName),
                    "Builder is missing method for field: " + configFieldName);
        }
    }
}
