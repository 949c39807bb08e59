package com.agenticImaging.protocolReview.extraction.strategy;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import lombok.RequiredArgsConstructor;

/**
 * Parses only the first brace-balanced object, ignoring whatever follows it.
 * Targets output that contains more than one object.
 */
@RequiredArgsConstructor
public class BalancedBraceStrategy implements RepairStrategy {
    
    private final StrictJsonParser parser;
    
    @Override
    public String name() {
        return "balanced-brace";
    }
    
    @Override
    public ParseOutcome attempt(String text) {
        String span = JsonTextRepairs.firstBalancedSpan(text);
        if (span == null) {
            return ParseOutcome.failed("braces never balance");
        }
        return parser.parse(JsonTextRepairs.removeTrailingCommas(span));
    }
}
