package com.agenticImaging.protocolReview.plausibility.service;

import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import com.agenticImaging.protocolReview.plausibility.model.HallucinationAnalysis;
import com.agenticImaging.protocolReview.review.model.ReviewFeedback;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;

import java.util.Map;

/**
 * Cross-checks the claims in a draft review against the source record and tool outputs.
 */
public interface PlausibilityAnalyzer {
    
    /**
     * @param draft Review feedback before any penalty
     * @param record Normalized patient record
     * @param toolOutputs Tool outputs keyed by tool name
     * @return Analysis whose confidence reduction is non-negative
     */
    HallucinationAnalysis analyze(ReviewFeedback draft, PatientRecord record, Map<String, ToolOutput> toolOutputs);
}
