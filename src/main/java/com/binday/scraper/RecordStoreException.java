package com.binday.scraper;

/**
 * Thrown when collection data cannot be written to or prepared in the record store.
 */
public class RecordStoreException extends RuntimeException {
    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
