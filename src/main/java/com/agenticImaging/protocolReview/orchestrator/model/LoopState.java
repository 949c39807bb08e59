package com.agenticImaging.protocolReview.orchestrator.model;

import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.review.model.ReviewReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mutable state of one pipeline run.
 * 
 * Owned by a single orchestration call and discarded when the run completes; never shared
 * between runs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoopState {
    
    private String runId;
    
    @Builder.Default
    private LoopPhase phase = LoopPhase.INIT;
    
    /**
     * Shared context produced at INIT.
     */
    private String context;
    
    /**
     * 1-based number of the current iteration, 0 before the first GENERATE.
     */
    private int iteration;
    
    private CandidateOutput lastCandidate;
    
    /**
     * Review of {@link #lastCandidate}; its feedback is what the next GENERATE receives.
     */
    private ReviewReport lastReview;
    
    public int nextIteration() {
        return ++iteration;
    }
}
