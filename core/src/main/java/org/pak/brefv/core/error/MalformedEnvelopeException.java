package org.pak.brefv.core.error;

/**
 * Bytes handed to the codec do not form a valid envelope.
 */
public class MalformedEnvelopeException extends CoreException {
    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
