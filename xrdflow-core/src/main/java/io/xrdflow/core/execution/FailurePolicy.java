package io.xrdflow.core.execution;

/// What a {@link ScanRunner} does when a plugin fails for one frame.
public enum FailurePolicy {
    /// Stop dispatching, discard outstanding frames and rethrow the failure.
    ABORT,
    /// Log the failure, leave the frame's slot zero-filled and continue.
    SKIP
}
