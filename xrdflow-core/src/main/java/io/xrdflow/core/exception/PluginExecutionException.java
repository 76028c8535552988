package io.xrdflow.core.exception;

import java.io.Serial;

/// Raised by a plugin whose `execute` call failed for one frame.
///
/// The workflow tree propagates it unchanged; whether the frame is skipped or the scan
/// aborted is decided by the caller.
public class PluginExecutionException extends Exception {
    @Serial private static final long serialVersionUID = -3088592711904263517L;

    public PluginExecutionException(String message) {
        super(message);
    }

    public PluginExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
