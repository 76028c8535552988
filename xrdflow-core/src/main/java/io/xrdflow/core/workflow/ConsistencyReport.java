package io.xrdflow.core.workflow;

import java.util.List;

/// Result of checking declared data dimensionality between every node and its parent.
///
/// @param consistentNodeIds nodes whose input fits their parent's output
/// @param inconsistentNodeIds nodes whose input does not fit their parent's output
public record ConsistencyReport(List<Integer> consistentNodeIds, List<Integer> inconsistentNodeIds) {

    public ConsistencyReport {
        consistentNodeIds = List.copyOf(consistentNodeIds);
        inconsistentNodeIds = List.copyOf(inconsistentNodeIds);
    }

    public boolean isConsistent() {
        return inconsistentNodeIds.isEmpty();
    }
}
