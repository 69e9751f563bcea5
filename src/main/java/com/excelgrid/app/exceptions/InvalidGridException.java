package com.excelgrid.app.exceptions;

/**
 * Thrown when requested grid dimensions or data are unusable,
 * e.g. negative sizes or more rows than the configured maximum.
 */
public class InvalidGridException extends RuntimeException {
    public InvalidGridException(String message) {
        super(message);
    }
}
