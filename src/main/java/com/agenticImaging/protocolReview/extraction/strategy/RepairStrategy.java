package com.agenticImaging.protocolReview.extraction.strategy;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;

/**
 * One stage of the structured-output recovery chain.
 * 
 * Each stage targets a single corruption mode seen in model output and must not throw.
 */
public interface RepairStrategy {
    
    /**
     * @return Short name used in diagnostics
     */
    String name();
    
    /**
     * Tries to recover a JSON object from the (fence-stripped) model text.
     * 
     * @param text Model text with code fences already removed
     * @return Parsed object or failure
     */
    ParseOutcome attempt(String text);
}
