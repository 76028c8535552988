package io.xrdflow.core.exception;

import java.io.Serial;

public class PluginNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 5127708823469501174L;

    public PluginNotFoundException(String message) {
        super(message);
    }
}
