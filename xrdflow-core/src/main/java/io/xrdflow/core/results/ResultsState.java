package io.xrdflow.core.results;

/// Allocation state of {@link WorkflowResults}.
///
/// ```
/// UNALLOCATED --updateShapesFromScanAndWorkflow--> ALLOCATED_METADATA_PENDING
///   --first storeResults of every node--> ALLOCATED_METADATA_COMPLETE
///   --clearAllResults--> UNALLOCATED
/// ```
public enum ResultsState {
    UNALLOCATED,
    ALLOCATED_METADATA_PENDING,
    ALLOCATED_METADATA_COMPLETE;

    public boolean isAllocated() {
        return this != UNALLOCATED;
    }
}
