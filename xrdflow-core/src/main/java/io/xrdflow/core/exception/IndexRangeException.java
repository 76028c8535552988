package io.xrdflow.core.exception;

import java.io.Serial;

/// Thrown when a frame index or scan position lies outside the scan.
public class IndexRangeException extends IndexOutOfBoundsException {
    @Serial private static final long serialVersionUID = 7730315248919504461L;

    public IndexRangeException(String message) {
        super(message);
    }
}
