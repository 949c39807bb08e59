package com.agenticImaging.protocolReview.review.service;

import com.agenticImaging.protocolReview.completion.exception.CompletionException;
import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import com.agenticImaging.protocolReview.extraction.service.StructuredOutputExtractor;
import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.normalization.model.PatientRecord;
import com.agenticImaging.protocolReview.review.model.ReviewFeedback;
import com.agenticImaging.protocolReview.review.prompt.ScoringPrompt;
import com.agenticImaging.protocolReview.rules.model.ToolOutput;
import com.agenticImaging.protocolReview.util.JsonFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives the bounded confidence attached to review feedback.
 * 
 * Two independent signals:
 * - a model-derived score for the candidate, best-effort and absent (not zero) when unavailable
 * - the reviewer's own confidence, minus the plausibility penalty, clamped to [0, 1]
 * 
 * Also owns the shape coercion that turns loosely-typed reviewer output into {@link ReviewFeedback}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfidenceEvaluator {
    
    public static final double DEFAULT_CONFIDENCE = 0.5;
    
    private final CompletionClient completionClient;
    private final StructuredOutputExtractor extractor;
    private final ObjectMapper objectMapper;
    
    @Value("${groq.api.scoring.model:}")
    private String scoringModel;
    
    /**
     * Asks the scoring model to rate a candidate. Never throws: a failed call, unparseable reply,
     * or non-numeric score all yield an empty result.
     * 
     * @param candidate Candidate under review
     * @param record Normalized patient record
     * @param toolOutput Filtered tool output shown to the scorer
     * @return Score in [0, 1], or empty if unavailable
     */
    public Optional<Double> scoreCandidate(CandidateOutput candidate, PatientRecord record, ToolOutput toolOutput) {
        String prompt = ScoringPrompt.build(
                JsonFiles.toPrettyJson(record),
                JsonFiles.toPrettyJson(toolOutput),
                JsonFiles.toPrettyJson(candidate));
        
        String raw;
        try {
            raw = completionClient.complete(prompt, scoringModel);
        } catch (CompletionException e) {
            log.warn("Candidate scoring call failed, score unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        
        ParseOutcome outcome = extractor.extractOutcome(raw);
        if (!outcome.isParsed()) {
            log.warn("Candidate score reply not parseable, score unavailable: {}", outcome.getFailureReason());
            return Optional.empty();
        }
        Optional<Double> score = readScore(outcome.getValue());
        if (score.isEmpty()) {
            log.warn("Candidate score reply has no numeric {}", ScoringPrompt.SCORE_KEY);
        }
        return score;
    }
    
    /**
     * Reads {@value ScoringPrompt#SCORE_KEY} from a parsed reply and clamps it to [0, 1].
     * 
     * @param parsed Parsed scoring reply
     * @return Clamped score, or empty if the key is absent or not a finite number
     */
    public static Optional<Double> readScore(Map<String, Object> parsed) {
        if (parsed == null) {
            return Optional.empty();
        }
        Double value = toDouble(parsed.get(ScoringPrompt.SCORE_KEY));
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(clamp(value));
    }
    
    /**
     * Coerces a parsed reviewer reply into the feedback shape.
     * issues and recommendations become string lists (a bare value becomes a one-element list),
     * confidence becomes a number in [0, 1], defaulting to {@value #DEFAULT_CONFIDENCE}.
     * 
     * @param parsed Parsed reply, may be null or the extractor's safe default
     * @return Feedback with all three fields present
     */
    public ReviewFeedback coerce(Map<String, Object> parsed) {
        Map<String, Object> source = parsed != null ? parsed : Map.of();
        
        List<String> issues = toStringList(source.get("issues"), "issues");
        List<String> recommendations = toStringList(source.get("recommendations"), "recommendations");
        
        Object rawConfidence = source.get("confidence");
        Double confidence = toDouble(rawConfidence);
        if (confidence == null) {
            if (rawConfidence != null) {
                log.warn("Reviewer confidence not numeric, defaulting to {} - value: {}", DEFAULT_CONFIDENCE, rawConfidence);
            }
            confidence = DEFAULT_CONFIDENCE;
        }
        
        return ReviewFeedback.builder()
                .issues(List.copyOf(issues))
                .recommendations(List.copyOf(recommendations))
                .confidence(clamp(confidence))
                .build();
    }
    
    /**
     * Subtracts a plausibility penalty from a base confidence.
     * Negative or NaN penalties count as zero, so the result never exceeds the clamped base.
     * 
     * @param baseConfidence Reviewer confidence
     * @param confidenceReduction Penalty from plausibility analysis
     * @return Penalized confidence in [0, 1]
     */
    public static double applyPenalty(double baseConfidence, double confidenceReduction) {
        double base = Double.isNaN(baseConfidence) ? DEFAULT_CONFIDENCE : baseConfidence;
        double penalty = confidenceReduction > 0 ? confidenceReduction : 0.0;
        return clamp(clamp(base) - penalty);
    }
    
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
    
    private static Double toDouble(Object value) {
        Double result = null;
        if (value instanceof Number) {
            result = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                result = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return result != null && Double.isFinite(result) ? result : null;
    }
    
    private List<String> toStringList(Object value, String fieldName) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    result.add(asText(item));
                }
            }
            return result;
        }
        log.warn("Reviewer {} is not a list, wrapping single value", fieldName);
        result.add(asText(value));
        return result;
    }
    
    private String asText(Object item) {
        if (item instanceof String) {
            return (String) item;
        }
        if (item instanceof Map || item instanceof Collection) {
            try {
                return objectMapper.writeValueAsString(item);
            } catch (JsonProcessingException e) {
                log.debug("Falling back to toString for reviewer item: {}", e.getOriginalMessage());
            }
        }
        return String.valueOf(item);
    }
}
