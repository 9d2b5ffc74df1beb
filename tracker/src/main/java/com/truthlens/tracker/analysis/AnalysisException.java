package com.truthlens.tracker.analysis;

/**
 * The analysis collaborator could not score the content.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
