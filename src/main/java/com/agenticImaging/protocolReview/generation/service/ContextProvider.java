package com.agenticImaging.protocolReview.generation.service;

import java.util.Map;

/**
 * One-time source of the shared context for a pipeline run.
 */
public interface ContextProvider {
    
    /**
     * @param record Raw patient record
     * @return Context text, or null/blank if none could be produced
     */
    String provideContext(Map<String, ?> record);
}
