package io.xrdflow.core.plugin;

import io.xrdflow.core.exception.PluginNotFoundException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/// Registry mapping plugin class names to plugin factories.
///
/// Used to reconstruct plugins from their serialized class name.
///
/// @see DefaultPluginRegistry
public interface PluginRegistry {

    /// Registers a factory under a class name, replacing any previous registration.
    ///
    /// @param pluginClass registry key as returned by {@link Plugin#getPluginClass()}, not null
    /// @param factory creates new plugin instances with default parameters, not null
    void register(String pluginClass, Supplier<? extends Plugin> factory);

    /// Creates a new plugin instance.
    ///
    /// @param pluginClass registry key, not null
    /// @return new instance, or empty if the name is not registered
    Optional<Plugin> createPlugin(String pluginClass);

    /// Creates a new plugin instance.
    ///
    /// @param pluginClass registry key, not null
    /// @return new instance, never null
    /// @throws PluginNotFoundException if the name is not registered
    Plugin createPluginOrThrow(String pluginClass) throws PluginNotFoundException;

    boolean hasPlugin(String pluginClass);

    /// Returns all registered class names in registration order.
    Set<String> getPluginClasses();

    /// Returns the class names of all registered plugins of one type.
    List<String> getPluginClasses(PluginType pluginType);
}
