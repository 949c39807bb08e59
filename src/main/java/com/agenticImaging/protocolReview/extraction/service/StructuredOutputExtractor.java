package com.agenticImaging.protocolReview.extraction.service;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import com.agenticImaging.protocolReview.extraction.strategy.BalancedBraceStrategy;
import com.agenticImaging.protocolReview.extraction.strategy.DirectParseStrategy;
import com.agenticImaging.protocolReview.extraction.strategy.GreedyObjectSpanStrategy;
import com.agenticImaging.protocolReview.extraction.strategy.JsonTextRepairs;
import com.agenticImaging.protocolReview.extraction.strategy.LineBreakFlatteningStrategy;
import com.agenticImaging.protocolReview.extraction.strategy.RepairStrategy;
import com.agenticImaging.protocolReview.extraction.strategy.StrictJsonParser;
import com.agenticImaging.protocolReview.extraction.strategy.TrailingCommaStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers one JSON object from free-form model output.
 * 
 * Code fences are stripped first, then each repair strategy is tried in order and the first
 * success wins:
 * direct -> greedy-span -> trailing-comma -> flatten-line-breaks -> balanced-brace.
 * When every stage fails, {@link #extract(String)} returns the safe default instead of throwing.
 * 
 * Stateless; one instance can serve any number of concurrent runs.
 */
@Slf4j
@Service
public class StructuredOutputExtractor {
    
    public static final String PARSE_FAILED_KEY = "parse_failed";
    public static final double SAFE_DEFAULT_CONFIDENCE = 0.5;
    
    private final List<RepairStrategy> strategies;
    
    public StructuredOutputExtractor() {
        this(defaultStrategies(new StrictJsonParser()));
    }
    
    public StructuredOutputExtractor(List<RepairStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }
    
    /**
     * @return Stages in the order they are attempted
     */
    public static List<RepairStrategy> defaultStrategies(StrictJsonParser parser) {
        return List.of(
                new DirectParseStrategy(parser),
                new GreedyObjectSpanStrategy(parser),
                new TrailingCommaStrategy(parser),
                new LineBreakFlatteningStrategy(parser),
                new BalancedBraceStrategy(parser)
        );
    }
    
    /**
     * Fixed-shape object returned when nothing can be recovered.
     * 
     * @return New mutable map: confidence 0.5, approved false, parse_failed true
     */
    public static Map<String, Object> safeDefault() {
        Map<String, Object> fallback = new LinkedHashMap<>();
        fallback.put("confidence", SAFE_DEFAULT_CONFIDENCE);
        fallback.put("feedback", "JSON parsing error in review");
        fallback.put("approved", false);
        fallback.put(PARSE_FAILED_KEY, true);
        return fallback;
    }
    
    /**
     * @return true if the map is the safe default rather than recovered output
     */
    public static boolean isSafeDefault(Map<String, Object> extracted) {
        return extracted != null && Boolean.TRUE.equals(extracted.get(PARSE_FAILED_KEY));
    }
    
    /**
     * Extracts a JSON object, falling back to {@link #safeDefault()}.
     * 
     * @param text Raw model output, may be null
     * @return Recovered object or the safe default, never null
     */
    public Map<String, Object> extract(String text) {
        ParseOutcome outcome = extractOutcome(text);
        if (outcome.isParsed()) {
            return outcome.getValue();
        }
        log.warn("JSON parsing failed for model output: {} - snippet: {}",
                outcome.getFailureReason(), snippet(text));
        return safeDefault();
    }
    
    /**
     * Runs the repair chain and reports the outcome of the last stage when all fail.
     * For callers that must treat unrecoverable output as an error rather than degrade.
     * 
     * @param text Raw model output, may be null
     * @return Parsed object or failure
     */
    public ParseOutcome extractOutcome(String text) {
        if (text == null || text.isBlank()) {
            return ParseOutcome.failed("empty model output");
        }
        String stripped = JsonTextRepairs.stripFences(text);
        ParseOutcome outcome = ParseOutcome.failed("no strategy attempted");
        for (RepairStrategy strategy : strategies) {
            outcome = strategy.attempt(stripped);
            if (outcome.isParsed()) {
                log.debug("Structured output recovered - strategy: {}", strategy.name());
                return outcome;
            }
            log.trace("Strategy {} failed: {}", strategy.name(), outcome.getFailureReason());
        }
        return outcome;
    }
    
    private static String snippet(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
