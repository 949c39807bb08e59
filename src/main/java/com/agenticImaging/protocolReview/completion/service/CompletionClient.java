package com.agenticImaging.protocolReview.completion.service;

/**
 * Blocking request/response access to a chat-completion model.
 * 
 * Every LLM-backed collaborator (context, generation, review, scoring, FHIR export)
 * goes through this seam so that runs can be driven by deterministic stubs in tests.
 */
public interface CompletionClient {
    
    /**
     * Sends a single user prompt and returns the raw text of the first choice.
     * 
     * @param userPrompt Prompt text
     * @param model Model identifier, or null/blank for the configured default
     * @return Raw completion text, never null
     * @throws com.agenticImaging.protocolReview.completion.exception.CompletionException if the call fails
     */
    String complete(String userPrompt, String model);
    
    /**
     * Verifies that credentials are present.
     * 
     * @throws com.agenticImaging.protocolReview.completion.exception.MissingApiKeyException if no API key is configured
     */
    void ensureConfigured();
}
