package com.agenticImaging.protocolReview.extraction.strategy;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import lombok.RequiredArgsConstructor;

/**
 * Parses the greedy object span after removing trailing commas before '}' and ']'.
 */
@RequiredArgsConstructor
public class TrailingCommaStrategy implements RepairStrategy {
    
    private final StrictJsonParser parser;
    
    @Override
    public String name() {
        return "trailing-comma";
    }
    
    @Override
    public ParseOutcome attempt(String text) {
        String span = JsonTextRepairs.greedyObjectSpan(text);
        if (span == null) {
            return ParseOutcome.failed("no object span");
        }
        return parser.parse(JsonTextRepairs.removeTrailingCommas(span));
    }
}
