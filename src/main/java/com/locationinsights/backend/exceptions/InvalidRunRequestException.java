package com.locationinsights.backend.exceptions;

/**
 * Caller input the run cannot accept (missing keyword, unknown export table and the like).
 */
public class InvalidRunRequestException extends RuntimeException {

    public InvalidRunRequestException(String message) {
        super(message);
    }
}
