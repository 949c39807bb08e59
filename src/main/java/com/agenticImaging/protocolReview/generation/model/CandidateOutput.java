package com.agenticImaging.protocolReview.generation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured proposal produced by one generation step.
 * 
 * The content is domain-opaque to the loop; it is serialized as a plain JSON object.
 */
@EqualsAndHashCode
@ToString
public final class CandidateOutput {
    
    private final Map<String, Object> content;
    
    private CandidateOutput(Map<String, Object> content) {
        this.content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }
    
    @JsonCreator
    public static CandidateOutput of(Map<String, Object> content) {
        return new CandidateOutput(content != null ? content : Map.of());
    }
    
    @JsonValue
    public Map<String, Object> asMap() {
        return content;
    }
    
    public Object get(String key) {
        return content.get(key);
    }
    
    public boolean isEmpty() {
        return content.isEmpty();
    }
}
