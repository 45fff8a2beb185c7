package org.pak.brefv.core.error;

import lombok.Getter;

public class MalformedKeyException extends CoreException {
    @Getter
    private final String key;

    public MalformedKeyException(String key, String expectedFormat) {
        super("Provided key " + key + " did not have the expected format " + expectedFormat);
        this.key = key;
    }
}
