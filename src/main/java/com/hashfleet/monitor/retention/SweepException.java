package com.hashfleet.monitor.retention;

/**
 * A retention sweep did not complete.
 */
public class SweepException extends RuntimeException {

    public SweepException(String message, Throwable cause) {
        super(message, cause);
    }
}
