package com.agenticImaging.protocolReview.orchestrator.model;

import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Terminal artifact of a pipeline run.
 */
@Value
@Builder
public class PipelineResult {
    
    @JsonProperty("run_id")
    String runId;
    
    @JsonProperty("final_output")
    CandidateOutput finalOutput;
    
    @JsonProperty("loops_run")
    int loopsRun;
    
    /**
     * Penalized reviewer confidence of the final iteration.
     */
    @JsonProperty("final_confidence")
    double finalConfidence;
    
    /**
     * Model-derived score of the final candidate; null when the scorer was unavailable.
     */
    @JsonProperty("candidate_confidence")
    Double candidateConfidence;
    
    /**
     * Whether the run stopped on the confidence gate rather than the iteration cap.
     */
    @JsonProperty("converged")
    boolean converged;
}
