package com.agenticImaging.protocolReview.generation.service;

import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.generation.prompt.CandidateGenerationPrompt;
import com.agenticImaging.protocolReview.review.model.ReviewFeedback;
import com.agenticImaging.protocolReview.util.JsonFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Generates a protocol recommendation with one model call per iteration.
 * Unparseable replies degrade to the extractor's safe default rather than failing the iteration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmCandidateGenerator implements CandidateGenerator {
    
    private final CompletionClient completionClient;
    private final StructuredOutputExtractor extractor;
    
    @Value("${groq.api.generation.model:}")
    private String generationModel;
    
    @Override
    public CandidateOutput generate(Map<String, ?> record, String context, ReviewFeedback feedback) {
        String prompt = CandidateGenerationPrompt.build(
                JsonFiles.toPrettyJson(record),
                context,
                feedback != null ? JsonFiles.toPrettyJson(feedback) : null);
        
        log.debug("Generating candidate - withFeedback: {}", feedback != null);
        
        Map<String, Object> parsed = extractor.extract(completionClient.complete(prompt, generationModel));
        if (StructuredOutputExtractor.isSafeDefault(parsed)) {
            log.warn("Generation output unrecoverable, candidate degraded to safe default");
        }
        return CandidateOutput.of(parsed);
    }
}
