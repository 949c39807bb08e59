package com.agenticImaging.protocolReview.review.model;

import com.agenticImaging.protocolReview.plausibility.model.HallucinationAnalysis;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Full output of one review step: the feedback handed to the next generation plus the audit trail
 * (scores, tool outputs, raw model text, plausibility analysis).
 */
@Value
@Builder
@JsonPropertyOrder({"issues", "recommendations", "confidence", "candidate_confidence", "timestamp",
        "tool_outputs", "raw_response", "hallucination_analysis", "feedback"})
public class ReviewReport {
    
    /**
     * Penalized feedback; this is what the next generation step sees.
     */
    @JsonProperty("feedback")
    ReviewFeedback feedback;
    
    /**
     * Model-derived score for the candidate, null when the scorer was unavailable.
     */
    @JsonProperty("candidate_confidence")
    Double candidateConfidence;
    
    /**
     * ISO-8601 UTC instant at which the review completed.
     */
    @JsonProperty("timestamp")
    String timestamp;
    
    @JsonProperty("tool_outputs")
    Map<String, ToolOutput> toolOutputs;
    
    @JsonProperty("raw_response")
    String rawResponse;
    
    @JsonProperty("hallucination_analysis")
    HallucinationAnalysis hallucinationAnalysis;
    
    @JsonProperty("issues")
    public List<String> getIssues() {
        return feedback.getIssues();
    }
    
    @JsonProperty("recommendations")
    public List<String> getRecommendations() {
        return feedback.getRecommendations();
    }
    
    @JsonProperty("confidence")
    public double getConfidence() {
        return feedback.getConfidence();
    }
}
