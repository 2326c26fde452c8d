package dev.modelkit.config;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Configuration for modelkit with sane defaults.
 *
 * <p>Every setting is read from an envar and can be overridden during config construction.
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode(callSuper = false)
public final class ModelKitConfig extends BaseConfig {
    private static final String USER_HOME = System.getProperty("user.home", ".");

    private final String home =
            getConfig("MODELKIT_HOME", Path.of(USER_HOME, ".modelkit").toString());
    private final String modelHome =
            getConfig("MODELKIT_MODEL_HOME", Path.of(home, "models").toString());
    private final String hfCacheHome =
            getConfig(
                    "HUGGINGFACE_HUB_CACHE",
                    Path.of(USER_HOME, ".cache", "huggingface", "hub").toString());
    private final String transformersPackage =
            getConfig("MODELKIT_TRANSFORMERS_PACKAGE", "dev.modelkit.transformers");
    private final String modelRegistryResource =
            getConfig("MODELKIT_MODEL_REGISTRY", "META-INF/modelkit/models");
    private final boolean debug = getConfig("MODELKIT_DEBUG", false);

    public static ModelKitConfig fromEnvironment() {
        return of();
    }

    public static ModelKitConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new ModelKitConfig(overridesMap);
    }

    private ModelKitConfig(Map<String, String> envOverrides) {
        super(envOverrides);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder home(String value) {
            envOverrides.put("MODELKIT_HOME", value);
            return this;
        }

        public Builder modelHome(String value) {
            envOverrides.put("MODELKIT_MODEL_HOME", value);
            return this;
        }

        public Builder hfCacheHome(String value) {
            envOverrides.put("HUGGINGFACE_HUB_CACHE", value);
            return this;
        }

        public Builder transformersPackage(String value) {
            envOverrides.put("MODELKIT_TRANSFORMERS_PACKAGE", value);
            return this;
        }

        public Builder modelRegistryResource(String value) {
            envOverrides.put("MODELKIT_MODEL_REGISTRY", value);
            return this;
        }

        public Builder debug(boolean value) {
            envOverrides.put("MODELKIT_DEBUG", String.valueOf(value));
            return this;
        }

        public ModelKitConfig build() {
            return new ModelKitConfig(envOverrides);
        }
    }
}
