package com.example.musiccollection.common.exception;

/**
 * The library core could not be reached or dropped the session mid-call.
 * Navigation retries on this after resetting the session.
 */
public class LibraryConnectionException extends RuntimeException {

    public LibraryConnectionException(String message) {
        super(message);
    }

    public LibraryConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
