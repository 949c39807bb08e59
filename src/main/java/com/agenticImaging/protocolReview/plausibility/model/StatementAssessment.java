package com.agenticImaging.protocolReview.plausibility.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Verdict on one factual claim found in a review statement.
 */
@Value
@Builder
@Jacksonized
public class StatementAssessment {
    
    @JsonProperty("statement")
    String statement;
    
    @JsonProperty("field")
    String field;
    
    @JsonProperty("claimed_value")
    Double claimedValue;
    
    @JsonProperty("record_value")
    Double recordValue;
    
    @JsonProperty("verdict")
    Verdict verdict;
    
    @JsonProperty("penalty")
    double penalty;
    
    @JsonProperty("reason")
    String reason;
}
