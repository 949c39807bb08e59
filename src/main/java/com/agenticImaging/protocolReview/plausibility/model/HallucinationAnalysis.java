package com.agenticImaging.protocolReview.plausibility.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Plausibility report for a draft review: per-claim verdicts and the resulting confidence deduction.
 */
@Value
@Builder
@Jacksonized
public class HallucinationAnalysis {
    
    @JsonProperty("recommendation")
    Recommendation recommendation;
    
    @Singular
    @JsonProperty("statements")
    List<StatementAssessment> statements;
    
    @Value
    @Builder
    @Jacksonized
    public static class Recommendation {
        
        /**
         * Amount to subtract from the reviewer confidence, never negative.
         */
        @JsonProperty("confidence_reduction")
        double confidenceReduction;
        
        @JsonProperty("contradicted")
        int contradicted;
        
        @JsonProperty("unsupported")
        int unsupported;
        
        @JsonProperty("summary")
        String summary;
    }
    
    /**
     * @return Analysis with no claims and no deduction
     */
    public static HallucinationAnalysis clean() {
        return HallucinationAnalysis.builder()
                .recommendation(Recommendation.builder()
                        .confidenceReduction(0.0)
                        .summary("No checkable claims")
                        .build())
                .build();
    }
    
    @JsonIgnore
    public double getConfidenceReduction() {
        return recommendation != null ? recommendation.getConfidenceReduction() : 0.0;
    }
}
