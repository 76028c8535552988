package io.xrdflow.core.exception;

import java.io.Serial;

/// Signals a structural or parameter misconfiguration of a workflow tree, a plugin or a scan.
///
/// Raised before or during shape propagation (duplicate or non-monotonic node ids, unknown
/// parents, unresolvable result shapes, unknown plugin classes). Never retried automatically.
public class ConfigException extends RuntimeException {
    @Serial private static final long serialVersionUID = 2841073960125583312L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
