package com.agenticImaging.protocolReview.extraction.strategy;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import lombok.RequiredArgsConstructor;

/**
 * Parses the greedy object span with raw line breaks flattened and trailing commas removed.
 * Targets string values that contain unescaped newlines.
 */
@RequiredArgsConstructor
public class LineBreakFlatteningStrategy implements RepairStrategy {
    
    private final StrictJsonParser parser;
    
    @Override
    public String name() {
        return "flatten-line-breaks";
    }
    
    @Override
    public ParseOutcome attempt(String text) {
        String span = JsonTextRepairs.greedyObjectSpan(text);
        if (span == null) {
            return ParseOutcome.failed("no object span");
        }
        String flattened = JsonTextRepairs.flattenLineBreaks(span);
        return parser.parse(JsonTextRepairs.removeTrailingCommas(flattened));
    }
}
