package com.agenticImaging.protocolReview.completion.exception;

/**
 * Exception thrown when a completion collaborator has no API key configured.
 */
public class MissingApiKeyException extends IllegalStateException {
    
    public MissingApiKeyException(String message) {
        super(message);
    }
}
