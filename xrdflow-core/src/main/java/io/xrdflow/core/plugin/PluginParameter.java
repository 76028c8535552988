package io.xrdflow.core.plugin;

import java.util.Objects;

/// Definition of one plugin parameter.
///
/// @param name parameter key, not null
/// @param type value type: `Integer`, `Double`, `String` or `Boolean`
/// @param defaultValue initial value, may be null for optional parameters
/// @param description human-readable description, never null
public record PluginParameter(String name, Class<?> type, Object defaultValue, String description) {

    public PluginParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (type != Integer.class
                && type != Double.class
                && type != String.class
                && type != Boolean.class) {
            throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
        }
        description = description == null ? "" : description;
    }

    public static PluginParameter ofInt(String name, Integer defaultValue, String description) {
        return new PluginParameter(name, Integer.class, defaultValue, description);
    }

    public static PluginParameter ofDouble(String name, Double defaultValue, String description) {
        return new PluginParameter(name, Double.class, defaultValue, description);
    }

    public static PluginParameter ofString(String name, String defaultValue, String description) {
        return new PluginParameter(name, String.class, defaultValue, description);
    }

    public static PluginParameter ofBoolean(
            String name, Boolean defaultValue, String description) {
        return new PluginParameter(name, Boolean.class, defaultValue, description);
    }
}
