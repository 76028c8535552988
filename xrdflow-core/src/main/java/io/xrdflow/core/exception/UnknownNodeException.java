package io.xrdflow.core.exception;

import java.io.Serial;
import java.util.NoSuchElementException;

public class UnknownNodeException extends NoSuchElementException {
    @Serial private static final long serialVersionUID = -1957461174839015520L;

    public UnknownNodeException(int nodeId) {
        super("No node with id " + nodeId + " is registered in the workflow tree");
    }
}
