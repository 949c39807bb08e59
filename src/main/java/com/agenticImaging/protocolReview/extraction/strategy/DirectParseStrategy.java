package com.agenticImaging.protocolReview.extraction.strategy;

import com.agenticImaging.protocolReview.extraction.model.ParseOutcome;
import lombok.RequiredArgsConstructor;

/**
 * Parses the text as-is.
 */
@RequiredArgsConstructor
public class DirectParseStrategy implements RepairStrategy {
    
    private final StrictJsonParser parser;
    
    @Override
    public String name() {
        return "direct";
    }
    
    @Override
    public ParseOutcome attempt(String text) {
        return parser.parse(text);
    }
}
