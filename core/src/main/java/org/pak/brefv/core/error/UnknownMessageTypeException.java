package org.pak.brefv.core.error;

import lombok.Getter;

public class UnknownMessageTypeException extends CoreException {
    @Getter
    private final String typeName;

    public UnknownMessageTypeException(String typeName) {
        super("Unknown message type: " + typeName);
        this.typeName = typeName;
    }
}
