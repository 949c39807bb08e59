package com.agenticImaging.protocolReview.review.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Reviewer verdict on one candidate: issues found, recommended changes, and a confidence in [0, 1].
 * All three fields are always present, defaulted when the upstream response was malformed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReviewFeedback {
    
    @Builder.Default
    @JsonProperty("issues")
    List<String> issues = List.of();
    
    @Builder.Default
    @JsonProperty("recommendations")
    List<String> recommendations = List.of();
    
    @JsonProperty("confidence")
    double confidence;
}
