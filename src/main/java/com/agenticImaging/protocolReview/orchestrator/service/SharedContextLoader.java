package com.agenticImaging.protocolReview.orchestrator.service;

import com.agenticImaging.protocolReview.completion.exception.CompletionException;
import com.agenticImaging.protocolReview.generation.prompt.EnhancedContextPrompt;
import com.agenticImaging.protocolReview.generation.service.ContextProvider;
import com.agenticImaging.protocolReview.orchestrator.exception.ArtifactPersistenceException;
import com.agenticImaging.protocolReview.orchestrator.exception.ContextInitializationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * INIT step: obtains the shared context for one run.
 * 
 * The context comes from the context provider only. It is recorded as
 * {@value ArtifactStore#CONTEXT_FILE} in the run's own directory and never read back, so no
 * run can see another run's context. No retry: a blank or failed answer aborts the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SharedContextLoader {
    
    private final ContextProvider contextProvider;
    private final ArtifactStore artifactStore;
    
    /**
     * @param runId Run the context belongs to
     * @param record Raw patient record
     * @return Non-blank shared context
     * @throws ContextInitializationException if the provider produces no context
     * @throws ArtifactPersistenceException if the context cannot be recorded
     */
    public String load(String runId, Map<String, ?> record) {
        String context;
        try {
            context = contextProvider.provideContext(record);
        } catch (CompletionException e) {
            log.error("Context provider failed - runId: {}", runId, e);
            throw new ContextInitializationException(
                    "Context provider failed to produce " + EnhancedContextPrompt.CONTEXT_KEY, e);
        }
        
        if (context == null || context.isBlank()) {
            throw new ContextInitializationException(
                    "Context provider did not produce " + EnhancedContextPrompt.CONTEXT_KEY);
        }
        
        artifactStore.saveContext(runId, context);
        return context;
    }
}
