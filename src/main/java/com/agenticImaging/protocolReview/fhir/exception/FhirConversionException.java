package com.agenticImaging.protocolReview.fhir.exception;

/**
 * Exception thrown when the final output cannot be converted to a valid FHIR bundle.
 */
public class FhirConversionException extends RuntimeException {
    
    public FhirConversionException(String message) {
        super(message);
    }
    
    public FhirConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
