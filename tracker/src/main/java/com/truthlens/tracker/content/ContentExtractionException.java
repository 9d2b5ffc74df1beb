package com.truthlens.tracker.content;

/**
 * Thrown when the main content of a page cannot be extracted.
 *
 * The tracker treats this as "nothing worth tracking": no analysis request
 * is issued and no consumption draft is logged for the page view.
 */
public class ContentExtractionException extends RuntimeException {

    public ContentExtractionException(String message) {
        super(message);
    }

    public ContentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
