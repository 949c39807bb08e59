package com.agenticImaging.protocolReview.completion.exception;

/**
 * Exception thrown when the completion endpoint cannot be reached or returns no content.
 */
public class CompletionException extends RuntimeException {
    
    public CompletionException(String message) {
        super(message);
    }
    
    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
