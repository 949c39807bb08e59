package com.agenticImaging.protocolReview.rules.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One check performed by a rule evaluator against a single patient field.
 */
@Value
@Builder
@Jacksonized
public class RuleCheck {
    
    @JsonProperty("name")
    String name;
    
    @JsonProperty("field")
    String field;
    
    @JsonProperty("status")
    CheckStatus status;
    
    @JsonProperty("priority")
    CheckPriority priority;
    
    /**
     * Observed value, null when the field is missing or not numeric.
     */
    @JsonProperty("value")
    Double value;
    
    @JsonProperty("message")
    String message;
    
    public boolean isOptionalAndMissing() {
        return status == CheckStatus.MISSING && priority == CheckPriority.OPTIONAL;
    }
}
