package com.agenticImaging.protocolReview.generation.service;

import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import com.agenticImaging.protocolReview.generation.prompt.EnhancedContextPrompt;
import com.agenticImaging.protocolReview.util.JsonFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Builds the enhanced clinical context with one model call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmContextProvider implements ContextProvider {
    
    private final CompletionClient completionClient;
    private final StructuredOutputExtractor extractor;
    
    @Value("${groq.api.context.model:}")
    private String contextModel;
    
    @Override
    public String provideContext(Map<String, ?> record) {
        String raw = completionClient.complete(EnhancedContextPrompt.build(JsonFiles.toPrettyJson(record)), contextModel);
        
        ParseOutcome outcome = extractor.extractOutcome(raw);
        if (!outcome.isParsed()) {
            log.warn("Context reply not parseable ({}), using raw text", outcome.getFailureReason());
            return raw;
        }
        Object context = outcome.getValue().get(EnhancedContextPrompt.CONTEXT_KEY);
        if (context == null) {
            log.warn("Context reply has no {} key", EnhancedContextPrompt.CONTEXT_KEY);
            return null;
        }
        return context instanceof String ? (String) context : JsonFiles.toPrettyJson(context);
    }
}
