package com.xcc.challenge.funnel.exception;

/**
 * The event log could not be read or decoded. Aborts the pipeline run.
 */
public class InputReadException extends RuntimeException {

    public InputReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
