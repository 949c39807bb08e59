package com.agenticImaging.protocolReview.extraction.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Map;

/**
 * Result of one parse attempt: either a parsed JSON object or a failure reason.
 */
@EqualsAndHashCode
@ToString
public final class ParseOutcome {
    
    private final Map<String, Object> value;
    private final String failureReason;
    
    private ParseOutcome(Map<String, Object> value, String failureReason) {
        this.value = value;
        this.failureReason = failureReason;
    }
    
    public static ParseOutcome parsed(Map<String, Object> value) {
        if (value == null) {
            throw new IllegalArgumentException("Parsed value cannot be null");
        }
        return new ParseOutcome(value, null);
    }
    
    public static ParseOutcome failed(String reason) {
        return new ParseOutcome(null, reason != null ? reason : "unknown");
    }
    
    public boolean isParsed() {
        return value != null;
    }
    
    /**
     * @return Parsed object
     * @throws IllegalStateException if this outcome is a failure
     */
    public Map<String, Object> getValue() {
        if (value == null) {
            throw new IllegalStateException("No parsed value: " + failureReason);
        }
        return value;
    }
    
    public String getFailureReason() {
        return failureReason;
    }
}
