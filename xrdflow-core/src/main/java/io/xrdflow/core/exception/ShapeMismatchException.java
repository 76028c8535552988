package io.xrdflow.core.exception;

import java.io.Serial;

/// Thrown when a plugin's actual output shape differs from the shape recorded during
/// shape propagation.
public class ShapeMismatchException extends RuntimeException {
    @Serial private static final long serialVersionUID = -6312849021754338810L;

    public ShapeMismatchException(String message) {
        super(message);
    }
}
