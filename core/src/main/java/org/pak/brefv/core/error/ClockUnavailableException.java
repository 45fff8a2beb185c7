package org.pak.brefv.core.error;

/**
 * The wall clock could not be read. Not a data-path error, callers are not expected to recover.
 */
public class ClockUnavailableException extends IllegalStateException {
    public ClockUnavailableException(Throwable cause) {
        super("Wall clock is unavailable", cause);
    }
}
