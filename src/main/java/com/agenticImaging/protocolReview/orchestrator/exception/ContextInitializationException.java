package com.agenticImaging.protocolReview.orchestrator.exception;

/**
 * Exception thrown when a run cannot obtain its shared context. Fatal to the run; never retried.
 */
public class ContextInitializationException extends RuntimeException {
    
    public ContextInitializationException(String message) {
        super(message);
    }
    
    public ContextInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
