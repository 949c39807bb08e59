package com.agenticImaging.protocolReview.extraction.strategy;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import lombok.RequiredArgsConstructor;

/**
 * Parses the span from the first '{' to the last '}', dropping surrounding commentary.
 */
@RequiredArgsConstructor
public class GreedyObjectSpanStrategy implements RepairStrategy {
    
    private final StrictJsonParser parser;
    
    @Override
    public String name() {
        return "greedy-span";
    }
    
    @Override
    public ParseOutcome attempt(String text) {
        String span = JsonTextRepairs.greedyObjectSpan(text);
        if (span == null) {
            return ParseOutcome.failed("no object span");
        }
        return parser.parse(span);
    }
}
