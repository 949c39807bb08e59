package com.agenticImaging.protocolReview.plausibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Verdict {
    SUPPORTED("supported"),
    CONTRADICTED("contradicted"),
    UNSUPPORTED("unsupported");
    
    private final String value;
    
    Verdict(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
