package com.jasmin.webloghunter.exceptions;

/**
 * Raised when an explicitly requested log input cannot be read.
 */
public class LogSourceException extends RuntimeException {

    public LogSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
