package com.hashfleet.monitor.ingest;

/**
 * An inbound report is malformed or incomplete. This is a client error.
 */
public class ReportValidationException extends RuntimeException {

    private final String field;

    public ReportValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
