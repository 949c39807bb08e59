package com.agenticImaging.protocolReview.rules.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single rule check.
 */
public enum CheckStatus {
    OK("ok"),
    MISSING("missing"),
    FLAGGED("flagged");
    
    private final String value;
    
    CheckStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
