package com.agenticImaging.protocolReview.generation.service;

import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.review.model.ReviewFeedback;

import java.util.Map;

/**
 * Produces one structured candidate per loop iteration.
 */
public interface CandidateGenerator {
    
    /**
     * @param record Raw patient record
     * @param context Shared context from INIT
     * @param feedback Previous iteration's feedback, null on the first iteration
     * @return Candidate output
     */
    CandidateOutput generate(Map<String, ?> record, String context, ReviewFeedback feedback);
}
