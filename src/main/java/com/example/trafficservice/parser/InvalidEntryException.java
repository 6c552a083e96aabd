package com.example.trafficservice.parser;

/**
 * A single capture entry that cannot become an exchange. Caught by the reader, which skips the
 * entry and records a diagnostic.
 */
class InvalidEntryException extends Exception {

    InvalidEntryException(String message) {
        super(message);
    }

    InvalidEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
