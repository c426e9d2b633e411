package com.xcc.challenge.funnel.exception;

/**
 * Writing the CSV export of the sessioned events failed.
 */
public class CsvExportException extends RuntimeException {

    public CsvExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
