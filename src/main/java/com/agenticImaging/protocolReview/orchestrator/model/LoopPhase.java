package com.agenticImaging.protocolReview.orchestrator.model;

/**
 * Phases of a pipeline run: INIT -> (GENERATE <-> REVIEW) -> DONE.
 */
public enum LoopPhase {
    INIT,
    GENERATE,
    REVIEW,
    DONE
}
