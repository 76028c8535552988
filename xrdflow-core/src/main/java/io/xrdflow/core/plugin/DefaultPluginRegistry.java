package io.xrdflow.core.plugin;

import io.xrdflow.core.exception.PluginNotFoundException;
import io.xrdflow.core.plugin.builtin.AxisSumPlugin;
import io.xrdflow.core.plugin.builtin.BinningPlugin;
import io.xrdflow.core.plugin.builtin.CropPlugin;
import io.xrdflow.core.plugin.builtin.SubtractBackgroundPlugin;
import io.xrdflow.core.plugin.builtin.SumPlugin;
import io.xrdflow.core.plugin.builtin.SyntheticFrameLoader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Default implementation of {@link PluginRegistry}.
///
/// Registers all built-in plugins on construction. Additional plugins can be registered
/// before trees are imported.
///
/// @implNote **Not thread-safe** for registration. Populate the registry at startup and
/// only read from it afterwards.
public class DefaultPluginRegistry implements PluginRegistry {

    private static final Logger logger = Logger.getLogger(DefaultPluginRegistry.class.getName());

    private final Map<String, Supplier<? extends Plugin>> registry = new LinkedHashMap<>();

    /// Creates a registry with all built-in plugins pre-registered.
    public DefaultPluginRegistry() {
        register("SyntheticFrameLoader", SyntheticFrameLoader::new);
        register("SubtractBackgroundPlugin", SubtractBackgroundPlugin::new);
        register("CropPlugin", CropPlugin::new);
        register("BinningPlugin", BinningPlugin::new);
        register("SumPlugin", SumPlugin::new);
        register("AxisSumPlugin", AxisSumPlugin::new);
    }

    @Override
    public void register(String pluginClass, Supplier<? extends Plugin> factory) {
        if (pluginClass == null || pluginClass.isBlank()) {
            throw new IllegalArgumentException("pluginClass cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (registry.put(pluginClass, factory) != null) {
            logger.warning("Replaced plugin registration: " + pluginClass);
        }
    }

    @Override
    public Optional<Plugin> createPlugin(String pluginClass) {
        Supplier<? extends Plugin> factory = registry.get(pluginClass);
        return factory == null ? Optional.empty() : Optional.of(factory.get());
    }

    @Override
    public Plugin createPluginOrThrow(String pluginClass) throws PluginNotFoundException {
        return createPlugin(pluginClass)
                .orElseThrow(
                        () ->
                                new PluginNotFoundException(
                                        "No plugin registered for class: " + pluginClass));
    }

    @Override
    public boolean hasPlugin(String pluginClass) {
        return registry.containsKey(pluginClass);
    }

    @Override
    public Set<String> getPluginClasses() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    @Override
    public List<String> getPluginClasses(PluginType pluginType) {
        return registry.entrySet().stream()
                .filter(entry -> entry.getValue().get().getPluginType() == pluginType)
                .map(Map.Entry::getKey)
                .toList();
    }
}
