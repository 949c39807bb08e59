package com.agenticImaging.protocolReview.rules.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckPriority {
    REQUIRED("required"),
    OPTIONAL("optional");
    
    private final String value;
    
    CheckPriority(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
