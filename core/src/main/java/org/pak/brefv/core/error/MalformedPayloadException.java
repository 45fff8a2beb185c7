package org.pak.brefv.core.error;

public class MalformedPayloadException extends CoreException {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
