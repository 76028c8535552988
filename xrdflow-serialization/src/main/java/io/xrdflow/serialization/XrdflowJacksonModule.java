package io.xrdflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.xrdflow.core.plugin.DefaultPluginRegistry;
import io.xrdflow.core.plugin.PluginRegistry;
import io.xrdflow.core.results.WorkflowResults;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowTree;
import java.io.Serial;

/// Jackson `SimpleModule` registering all xrdflow serializers in one place.
///
/// - `WorkflowTree`: `WorkflowTreeSerializer` / `WorkflowTreeDeserializer`, a list of node
///   records; plugins are instantiated through the module's {@link PluginRegistry}
/// - `ScanGeometry`: `ScanGeometrySerializer` / `ScanGeometryDeserializer`, flat
///   `scan_dim{i}_*` keys
/// - `WorkflowResults`: `WorkflowResultsSerializer`, write-only
///
/// @implNote All registrations are explicit; no classpath scanning, no annotations on core
/// types.
/// @see TreeSerializer for the convenience factory API
public class XrdflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3318842911527260817L;

    /// Creates the module with the built-in plugins.
    public XrdflowJacksonModule() {
        this(new DefaultPluginRegistry());
    }

    /// Creates the module.
    ///
    /// @param pluginRegistry resolves `plugin_class` entries when trees are read, not null
    public XrdflowJacksonModule(PluginRegistry pluginRegistry) {
        super("XrdflowJacksonModule");

        addSerializer(WorkflowTree.class, new WorkflowTreeSerializer());
        addDeserializer(WorkflowTree.class, new WorkflowTreeDeserializer(pluginRegistry));

        addSerializer(ScanGeometry.class, new ScanGeometrySerializer());
        addDeserializer(ScanGeometry.class, new ScanGeometryDeserializer());

        addSerializer(WorkflowResults.class, new WorkflowResultsSerializer());
    }
}
