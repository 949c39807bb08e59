package com.agenticImaging.protocolReview.review.service;

import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import com.agenticImaging.protocolReview.normalization.service.FieldNormalizer;
import com.agenticImaging.protocolReview.plausibility.model.HallucinationAnalysis;
import com.agenticImaging.protocolReview.plausibility.service.PlausibilityAnalyzer;
import com.agenticImaging.protocolReview.review.model.ReviewFeedback;
import com.agenticImaging.protocolReview.review.model.ReviewReport;
import com.agenticImaging.protocolReview.review.prompt.ReviewPrompt;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;
import com.agenticImaging.protocolReview.rules.service.RuleEvaluator;
import com.agenticImaging.protocolReview.util.JsonFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one review of a candidate and turns the reviewer's free text into typed feedback.
 * 
 * Sequence: NORMALIZE -> EVALUATE_RULES -> FILTER -> SCORE (best-effort) -> REVIEW_CALL
 * -> EXTRACT/COERCE -> PLAUSIBILITY -> PENALIZE.
 * Malformed reviewer text never raises here; it degrades to default feedback. A failed
 * review call itself does propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewStepAdapter {
    
    private final FieldNormalizer fieldNormalizer;
    private final RuleEvaluator ruleEvaluator;
    private final ConfidenceEvaluator confidenceEvaluator;
    private final CompletionClient completionClient;
    private final StructuredOutputExtractor extractor;
    private final PlausibilityAnalyzer plausibilityAnalyzer;
    private final Clock clock;
    
    @Value("${groq.api.review.model:}")
    private String reviewModel;
    
    /**
     * Reviews a candidate against the patient record.
     * 
     * @param rawRecord Patient record as received, keys not yet normalized
     * @param candidate Candidate produced by the generation step
     * @return Review report with penalized feedback
     */
    public ReviewReport review(Map<String, ?> rawRecord, CandidateOutput candidate) {
        PatientRecord record = fieldNormalizer.toRecord(rawRecord);
        
        ToolOutput toolOutput = ruleEvaluator.evaluate(record).withoutOptionalMissing();
        Map<String, ToolOutput> toolOutputs = Map.of(ruleEvaluator.toolName(), toolOutput);
        
        Optional<Double> candidateConfidence = confidenceEvaluator.scoreCandidate(candidate, record, toolOutput);
        
        String prompt = ReviewPrompt.build(
                JsonFiles.toPrettyJson(rawRecord),
                JsonFiles.toPrettyJson(record),
                JsonFiles.toPrettyJson(toolOutput),
                JsonFiles.toPrettyJson(candidate));
        
        log.info("Calling reviewer - fields: {}, checks: {}, candidateScore: {}",
                record.size(), toolOutput.getChecks().size(), candidateConfidence.orElse(null));
        
        String rawResponse = completionClient.complete(prompt, reviewModel);
        
        Map<String, Object> parsed = extractor.extract(rawResponse);
        if (StructuredOutputExtractor.isSafeDefault(parsed)) {
            log.warn("Reviewer output unrecoverable, using default feedback");
        }
        ReviewFeedback draft = confidenceEvaluator.coerce(parsed);
        
        HallucinationAnalysis analysis = plausibilityAnalyzer.analyze(draft, record, toolOutputs);
        double penalized = ConfidenceEvaluator.applyPenalty(draft.getConfidence(), analysis.getConfidenceReduction());
        ReviewFeedback feedback = draft.toBuilder()
                .confidence(penalized)
                .build();
        
        log.info("Review completed - issues: {}, recommendations: {}, confidence: {} (reviewer {}, reduction {})",
                feedback.getIssues().size(), feedback.getRecommendations().size(),
                penalized, draft.getConfidence(), analysis.getConfidenceReduction());
        
        return ReviewReport.builder()
                .feedback(feedback)
                .candidateConfidence(candidateConfidence.orElse(null))
                .timestamp(Instant.now(clock).toString())
                .toolOutputs(toolOutputs)
                .rawResponse(rawResponse)
                .hallucinationAnalysis(analysis)
                .build();
    }
}
