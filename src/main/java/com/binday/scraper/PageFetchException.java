package com.binday.scraper;

/**
 * Thrown when the results page cannot be obtained from the council site.
 */
public class PageFetchException extends RuntimeException {
    public PageFetchException(String message) {
        super(message);
    }

    public PageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
