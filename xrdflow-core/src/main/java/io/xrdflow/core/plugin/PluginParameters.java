package io.xrdflow.core.plugin;

import io.xrdflow.core.exception.ConfigException;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Ordered, typed parameter collection of a plugin.
///
/// Every plugin carries the generic parameters {@link #LABEL} and {@link #KEEP_RESULTS};
/// plugin-specific parameters are added by the plugin's constructor.
///
/// Values passed to {@link #set(String, Object)} are coerced to the declared type:
/// numbers convert between integer and floating point (integers only when the value is
/// integral), and strings are parsed. This keeps values read from YAML or the command line
/// usable without further conversion.
///
/// @implNote **Not thread-safe**. Each plugin instance owns its own collection.
public final class PluginParameters {

    public static final String LABEL = "label";
    public static final String KEEP_RESULTS = "keep_results";

    private final Map<String, PluginParameter> definitions = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();

    /// Creates a collection holding only the generic parameters.
    public PluginParameters() {
        add(PluginParameter.ofString(LABEL, "", "A label to identify the node's results"));
        add(
                PluginParameter.ofBoolean(
                        KEEP_RESULTS,
                        false,
                        "Keep the results of this node even if it is not a leaf"));
    }

    /// Adds a parameter definition and initialises its value with the default.
    ///
    /// @throws IllegalArgumentException if a parameter with the same name exists
    public void add(PluginParameter parameter) {
        if (definitions.containsKey(parameter.name())) {
            throw new IllegalArgumentException("Duplicate parameter: " + parameter.name());
        }
        definitions.put(parameter.name(), parameter);
        values.put(parameter.name(), parameter.defaultValue());
    }

    public boolean has(String name) {
        return definitions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public PluginParameter getDefinition(String name) {
        PluginParameter parameter = definitions.get(name);
        if (parameter == null) {
            throw new ConfigException("Unknown plugin parameter: " + name);
        }
        return parameter;
    }

    /// Returns the current value, may be null.
    ///
    /// @throws ConfigException if no such parameter exists
    public Object get(String name) {
        getDefinition(name);
        return values.get(name);
    }

    public Integer getInt(String name) {
        return (Integer) get(name);
    }

    public Double getDouble(String name) {
        return (Double) get(name);
    }

    public String getString(String name) {
        return (String) get(name);
    }

    public boolean getBoolean(String name) {
        return Boolean.TRUE.equals(get(name));
    }

    /// Sets a value, coercing it to the declared type.
    ///
    /// @param name parameter name, not null
    /// @param value new value, may be null
    /// @throws ConfigException if the parameter is unknown or the value cannot be converted
    public void set(String name, Object value) {
        PluginParameter definition = getDefinition(name);
        values.put(name, coerce(definition, value));
    }

    /// Copies all values of another collection with the same parameter names.
    public void setAll(PluginParameters other) {
        for (Map.Entry<String, Object> entry : other.values.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    /// Returns the values as ordered `(key, value)` pairs.
    public List<Map.Entry<String, Object>> entries() {
        List<Map.Entry<String, Object>> entries = new ArrayList<>();
        values.forEach((k, v) -> entries.add(new SimpleImmutableEntry<>(k, v)));
        return entries;
    }

    private static Object coerce(PluginParameter definition, Object value) {
        if (value == null || definition.type().isInstance(value)) {
            return value;
        }
        Class<?> type = definition.type();
        try {
            if (type == Double.class) {
                if (value instanceof Number number) {
                    return number.doubleValue();
                }
                return Double.parseDouble(value.toString().trim());
            }
            if (type == Integer.class) {
                if (value instanceof Number number) {
                    double d = number.doubleValue();
                    if (d != Math.rint(d)) {
                        throw new NumberFormatException("not an integer: " + value);
                    }
                    return number.intValue();
                }
                return Integer.parseInt(value.toString().trim());
            }
            if (type == Boolean.class) {
                String text = value.toString().trim();
                if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
                    return Boolean.parseBoolean(text);
                }
                throw new IllegalArgumentException("not a boolean: " + value);
            }
            return value.toString();
        } catch (IllegalArgumentException e) {
            throw new ConfigException(
                    "Invalid value '"
                            + value
                            + "' for parameter '"
                            + definition.name()
                            + "' of type "
                            + type.getSimpleName(),
                    e);
        }
    }
}
