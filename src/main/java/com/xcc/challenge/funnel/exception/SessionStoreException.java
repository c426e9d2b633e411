package com.xcc.challenge.funnel.exception;

/**
 * Reading or writing the sessioned events table failed.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
