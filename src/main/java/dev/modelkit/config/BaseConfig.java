package dev.modelkit.config;

import java.util.Map;
import javax.annotation.Nullable;

/**
 * Base for env-driven configuration. Subclasses declare their settings as field initializers that
 * call one of the {@code getConfig} variants; every value can be overridden at construction time.
 */
abstract class BaseConfig {
    /** Override value that forces a setting to null even when the envar is set. */
    static final String NULL_OVERRIDE = "__MODELKIT_NULL_OVERRIDE__";

    private final Map<String, String> envOverrides;

    protected BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected String getRequiredConfig(String key) {
        var value = lookup(key);
        if (value == null) {
            throw new IllegalStateException("missing required config: " + key);
        }
        return value;
    }

    protected String getConfig(String key, String defaultValue) {
        return getConfig(key, defaultValue, String.class);
    }

    protected boolean getConfig(String key, boolean defaultValue) {
        return getConfig(key, defaultValue, Boolean.class);
    }

    protected int getConfig(String key, int defaultValue) {
        return getConfig(key, defaultValue, Integer.class);
    }

    @Nullable
    protected <T> T getConfig(String key, @Nullable T defaultValue, Class<T> type) {
        if (envOverrides.containsKey(key) && NULL_OVERRIDE.equals(envOverrides.get(key))) {
            return null;
        }
        var raw = lookup(key);
        if (raw == null) {
            return defaultValue;
        }
        return convert(key, raw.trim(), type);
    }

    @Nullable
    private String lookup(String key) {
        if (envOverrides.containsKey(key)) {
            var value = envOverrides.get(key);
            return NULL_OVERRIDE.equals(value) ? null : value;
        }
        return System.getenv(key);
    }

    private static <T> T convert(String key, String raw, Class<T> type) {
        if (type == String.class) {
            return type.cast(raw);
        } else if (type == Boolean.class) {
            return type.cast(Boolean.parseBoolean(raw));
        } else if (type == Integer.class) {
            try {
                return type.cast(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new IllegalStateException(
                        "config %s is not an integer: %s".formatted(key, raw), e);
            }
        }
        throw new IllegalArgumentException("unsupported config type: " + type.getName());
    }
}
